package eu.virtualparadox.titanshield.knowledge.index;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.knowledge.model.Chunk;
import eu.virtualparadox.titanshield.rag.embed.EmbeddingClient;
import eu.virtualparadox.titanshield.resilience.DependencyResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orchestrates loading of an enriched chunk artifact into the knowledge index:
 * <ol>
 *     <li>Read chunks from the JSONL artifact</li>
 *     <li>Embed every chunk with the configured {@link EmbeddingClient}</li>
 *     <li>Only then upsert chunks + vectors into Lucene, one source at a time</li>
 * </ol>
 * Any chunk that cannot be embedded fails the whole ingest; a partially populated index would misreport coverage.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KnowledgeIngestService {

    private final ChunkArtifactReader artifactReader;
    private final EmbeddingClient embeddingClient;
    private final ChunkIndexService chunkIndexService;
    private final TitanShieldProperties props;

    /**
     * @return number of chunks written
     */
    public int ingest(final Path artifact) {
        try {
            final List<Chunk> chunks = artifactReader.read(artifact);
            log.info("Ingesting {} chunks from {} using {} embeddings", chunks.size(), artifact, embeddingClient.name());
            return ingest(chunks);
        } catch (final IOException e) {
            throw new IllegalStateException("Ingest failed for artifact: " + artifact, e);
        }
    }

    /**
     * Embeds every chunk before writing any of them, so a failed embedding leaves the index untouched.
     *
     * @throws IllegalArgumentException if two chunks share an id
     * @throws IllegalStateException    if a chunk cannot be embedded
     */
    public int ingest(final List<Chunk> chunks) throws IOException {
        final Duration timeout = props.getRetrieval().getEmbeddingTimeout();

        final Map<String, List<Chunk>> bySource = new LinkedHashMap<>();
        final Set<String> ids = new HashSet<>();
        for (final Chunk chunk : chunks) {
            if (!ids.add(chunk.id())) {
                throw new IllegalArgumentException("Duplicate chunk id " + chunk.id() + " in source " + chunk.source());
            }
            if (!chunk.hasConsistentValidity()) {
                log.warn("Chunk {} has validFrom {} after validUntil {}; it will not be filtered by year",
                        chunk.id(), chunk.validFrom(), chunk.validUntil());
            }
            bySource.computeIfAbsent(chunk.source(), s -> new ArrayList<>()).add(chunk);
        }

        final Map<String, List<float[]>> vectorsBySource = new LinkedHashMap<>();
        for (final Map.Entry<String, List<Chunk>> entry : bySource.entrySet()) {
            final List<float[]> vectors = new ArrayList<>(entry.getValue().size());
            for (final Chunk chunk : entry.getValue()) {
                final DependencyResult<float[]> vector = embeddingClient.embed(chunk.text(), timeout);
                if (!vector.isSuccess()) {
                    throw new IllegalStateException(
                            "Cannot embed chunk " + chunk.id() + ": " + vector.failure().describe());
                }
                vectors.add(vector.value());
            }
            vectorsBySource.put(entry.getKey(), vectors);
        }

        int written = 0;
        for (final Map.Entry<String, List<Chunk>> entry : bySource.entrySet()) {
            chunkIndexService.upsert(entry.getKey(), entry.getValue(), vectorsBySource.get(entry.getKey()));
            written += entry.getValue().size();
            log.debug("Indexed {} chunks of source {}", entry.getValue().size(), entry.getKey());
        }
        log.info("Indexed {} chunks from {} sources", written, bySource.size());
        return written;
    }
}
