package eu.virtualparadox.titanshield.rag.retriever.service;

import eu.virtualparadox.titanshield.knowledge.model.Chunk;
import eu.virtualparadox.titanshield.rag.retriever.model.ScoredChunk;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Year-based validity of chunks.
 * <p>
 * Filtering is opt-in: without a target year every chunk is valid. A chunk whose window is inverted
 * ({@code validFrom > validUntil}) carries no usable constraint and is also always valid.
 */
@Component
public class TemporalFilter {

    /**
     * @return {@code validFrom <= targetYear <= validUntil}, or {@code true} when there is no target year
     */
    public boolean isValid(final Chunk chunk, final Integer targetYear) {
        if (targetYear == null || !chunk.hasConsistentValidity()) {
            return true;
        }
        return chunk.validFrom() <= targetYear && targetYear <= chunk.validUntil();
    }

    /**
     * Recency signal in {@code (0, 1]}: {@code 1 / (1 + |validFrom - targetYear|)}. Strictly decreasing as the
     * distance grows; {@code 0} when there is no target year.
     */
    public double rank(final Chunk chunk, final Integer targetYear) {
        if (targetYear == null) {
            return 0.0;
        }
        final long distance = Math.abs((long) chunk.validFrom() - targetYear);
        return 1.0 / (1.0 + distance);
    }

    /**
     * Keeps the valid entries of a leg, preserving order.
     */
    public List<ScoredChunk> retainValid(final List<ScoredChunk> leg, final Integer targetYear) {
        if (targetYear == null) {
            return leg;
        }
        return leg.stream()
                .filter(sc -> isValid(sc.chunk(), targetYear))
                .toList();
    }
}
