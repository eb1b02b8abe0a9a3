package eu.virtualparadox.titanshield.safety;

import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.knowledge.store.KnowledgeStoreConfigurationException;
import eu.virtualparadox.titanshield.rag.embed.EmbeddingClient;
import eu.virtualparadox.titanshield.resilience.DependencyResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Provides the {@link UnsafeIntentMatrix}, loaded once at startup.
 * <p>
 * A JSON file of float arrays at {@code titanshield.paths.safety-matrix} is used when present. Otherwise the
 * configured seed questions are embedded and, if a path is configured, the result is written there for the next
 * start. Without file and seeds the matrix is empty and screening relies on keywords.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class UnsafeIntentMatrixLoader {

    private final ObjectMapper objectMapper;

    @Bean
    public UnsafeIntentMatrix unsafeIntentMatrix(final EmbeddingClient embeddingClient,
                                                 final TitanShieldProperties props) throws IOException {
        final UnsafeIntentMatrix matrix = load(props.getPaths().getSafetyMatrix(), embeddingClient, props.getSafety());
        if (!matrix.isEmpty() && matrix.dimension() != embeddingClient.dimension()) {
            throw new KnowledgeStoreConfigurationException("Unsafe-intent matrix dimension " + matrix.dimension()
                    + " differs from embedding dimension " + embeddingClient.dimension());
        }
        if (matrix.isEmpty()) {
            log.warn("Unsafe-intent matrix is empty; safety screening uses keywords only");
        } else {
            log.info("Unsafe-intent matrix ready: {} vectors of dimension {}", matrix.size(), matrix.dimension());
        }
        return matrix;
    }

    UnsafeIntentMatrix load(final Path path,
                            final EmbeddingClient embeddingClient,
                            final TitanShieldProperties.Safety safety) throws IOException {
        if (path != null && Files.isRegularFile(path)) {
            log.info("Loading unsafe-intent matrix from {}", path);
            return new UnsafeIntentMatrix(objectMapper.readValue(path.toFile(), float[][].class));
        }

        final float[][] rows = embedSeeds(embeddingClient, safety);
        if (path != null && rows.length > 0) {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), rows);
            log.info("Wrote unsafe-intent matrix built from {} seed questions to {}", rows.length, path);
        }
        return new UnsafeIntentMatrix(rows);
    }

    private float[][] embedSeeds(final EmbeddingClient embeddingClient, final TitanShieldProperties.Safety safety) {
        final List<float[]> rows = new ArrayList<>();
        for (final String seed : safety.getSeedQuestions()) {
            final DependencyResult<float[]> vector = embeddingClient.embed(seed, safety.getEmbeddingTimeout());
            if (vector.isSuccess()) {
                rows.add(vector.value());
            } else {
                log.warn("Skipping safety seed '{}': {}", seed, vector.failure().describe());
            }
        }
        return rows.toArray(new float[0][]);
    }
}
