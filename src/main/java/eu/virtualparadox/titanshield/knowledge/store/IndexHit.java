package eu.virtualparadox.titanshield.knowledge.store;

/**
 * One entry of a lexical or vector result list, in the order the index returned it.
 *
 * @param chunkId identifier of the matched chunk
 * @param score   raw leg score (BM25 or vector similarity); only its position is used for fusion
 */
public record IndexHit(String chunkId, float score) {
}
