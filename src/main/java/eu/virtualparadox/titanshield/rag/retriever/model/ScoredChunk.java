package eu.virtualparadox.titanshield.rag.retriever.model;

import eu.virtualparadox.titanshield.knowledge.model.Chunk;

/**
 * A chunk paired with a per-query relevance score.
 *
 * @param chunk  the matched chunk
 * @param score  BM25 or similarity score for leg results, RRF score for {@link RetrievalSource#FUSED} results
 * @param source producing list
 */
public record ScoredChunk(Chunk chunk, double score, RetrievalSource source) {

    public String chunkId() {
        return chunk.id();
    }
}
