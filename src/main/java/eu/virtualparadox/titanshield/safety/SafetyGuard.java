package eu.virtualparadox.titanshield.safety;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.rag.embed.EmbeddingClient;
import eu.virtualparadox.titanshield.resilience.Degradation;
import eu.virtualparadox.titanshield.resilience.DependencyResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Pre-inference firewall. A query is unsafe when its embedding is at least {@code threshold} similar to any
 * unsafe-intent vector, or when it contains one of the configured unsafe phrases.
 * <p>
 * The keyword scan always runs. If the embedding cannot be obtained the verdict rests on the keywords alone and
 * carries {@link Degradation#SAFETY_KEYWORD_ONLY}.
 */
@Service
@Slf4j
public class SafetyGuard {

    private final EmbeddingClient embeddingClient;
    private final UnsafeIntentMatrix matrix;
    private final PhraseMatcher unsafeKeywords;
    private final double threshold;
    private final Duration embeddingTimeout;

    @Autowired
    public SafetyGuard(final EmbeddingClient embeddingClient,
                       final UnsafeIntentMatrix matrix,
                       final TitanShieldProperties props) {
        this(embeddingClient,
                matrix,
                new PhraseMatcher(props.getSafety().getUnsafeKeywords()),
                props.getSafety().getThreshold(),
                props.getSafety().getEmbeddingTimeout());
    }

    public SafetyGuard(final EmbeddingClient embeddingClient,
                       final UnsafeIntentMatrix matrix,
                       final PhraseMatcher unsafeKeywords,
                       final double threshold,
                       final Duration embeddingTimeout) {
        this.embeddingClient = embeddingClient;
        this.matrix = matrix;
        this.unsafeKeywords = unsafeKeywords;
        this.threshold = threshold;
        this.embeddingTimeout = embeddingTimeout;
    }

    public SafetyVerdict check(final String queryText) {
        return check(queryText, null);
    }

    /**
     * @param deadline absolute deadline of the question; the embedding gets the smaller of the remaining time and the
     *                 configured embedding timeout. {@code null} for the configured timeout alone.
     */
    public SafetyVerdict check(final String queryText, final Instant deadline) {
        final Optional<String> keyword = unsafeKeywords.firstMatch(queryText);
        final Set<Degradation> degradations = EnumSet.noneOf(Degradation.class);

        double similarity = 0.0;
        if (queryText != null && !queryText.isBlank()) {
            if (matrix.isEmpty()) {
                degradations.add(Degradation.SAFETY_MATRIX_MISSING);
            } else {
                final double sMax = similarity(queryText, embeddingBudget(deadline));
                if (Double.isNaN(sMax)) {
                    degradations.add(Degradation.SAFETY_KEYWORD_ONLY);
                } else {
                    similarity = Math.max(0.0, Math.min(1.0, sMax));
                }
            }
        }

        final boolean unsafe = keyword.isPresent() || similarity >= threshold;
        if (unsafe) {
            log.info("Query flagged unsafe (similarity={}, keyword={})",
                    String.format("%.4f", similarity), keyword.orElse("-"));
        }
        return new SafetyVerdict(unsafe, similarity, keyword.orElse(null), degradations);
    }

    /**
     * @return maximum similarity, or NaN when it cannot be computed
     */
    private double similarity(final String queryText, final Duration budget) {
        final DependencyResult<float[]> embedding = embeddingClient.embed(queryText, budget);
        if (!embedding.isSuccess()) {
            log.warn("Safety check falls back to keywords only: {}", embedding.failure().describe());
            return Double.NaN;
        }
        final float[] vector = embedding.value();
        if (vector.length != matrix.dimension()) {
            log.warn("Safety check falls back to keywords only: embedding dimension {} != matrix dimension {}",
                    vector.length, matrix.dimension());
            return Double.NaN;
        }
        final double sMax = matrix.maxSimilarity(vector);
        if (Double.isNaN(sMax)) {
            log.warn("Safety check falls back to keywords only: unusable query vector");
        }
        return sMax;
    }

    private Duration embeddingBudget(final Instant deadline) {
        if (deadline == null) {
            return embeddingTimeout;
        }
        final Duration remaining = Duration.between(Instant.now(), deadline);
        return remaining.compareTo(embeddingTimeout) < 0 ? remaining : embeddingTimeout;
    }
}
