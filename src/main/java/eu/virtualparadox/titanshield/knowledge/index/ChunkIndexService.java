package eu.virtualparadox.titanshield.knowledge.index;

import eu.virtualparadox.titanshield.knowledge.model.Chunk;

import java.io.IOException;
import java.util.List;

/**
 * Write side of the knowledge index. Used offline and at startup; never at query time.
 */
public interface ChunkIndexService {

    /**
     * Replaces every chunk previously written for {@code source} with the given chunks.
     *
     * @param source  source label the chunks belong to
     * @param chunks  chunks to write
     * @param vectors one vector per chunk, in the same order
     */
    void upsert(String source, List<Chunk> chunks, List<float[]> vectors) throws IOException;

    void deleteBySource(String source) throws IOException;
}
