package eu.virtualparadox.titanshield.knowledge.store;

import eu.virtualparadox.titanshield.knowledge.model.Chunk;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the chunk corpus and its two indices.
 * <p>Implementations must be safe for concurrent use by many queries.</p>
 */
public interface KnowledgeStore {

    /**
     * BM25 keyword search.
     *
     * @param queryText free query text
     * @param entities  salient phrases that should weigh more than ordinary terms; may be empty
     * @param filter    candidate restriction
     * @param limit     maximum number of hits
     * @return hits ordered by descending score
     */
    List<IndexHit> lexicalSearch(String queryText, List<String> entities, CandidateFilter filter, int limit)
            throws IOException;

    /**
     * Nearest-neighbour search over chunk vectors.
     *
     * @return hits ordered by descending similarity
     */
    List<IndexHit> vectorSearch(float[] queryVector, CandidateFilter filter, int limit) throws IOException;

    Optional<Chunk> getChunk(String chunkId) throws IOException;

    /**
     * Number of chunks currently searchable.
     */
    int size() throws IOException;
}
