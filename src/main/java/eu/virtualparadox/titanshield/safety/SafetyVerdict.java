package eu.virtualparadox.titanshield.safety;

import eu.virtualparadox.titanshield.resilience.Degradation;

import java.util.Optional;
import java.util.Set;

/**
 * Outcome of screening one query.
 *
 * @param unsafe         whether the query must be answered with a refusal option
 * @param similarity     highest similarity to the unsafe-intent matrix, clamped to {@code [0, 1]}; {@code 0} when
 *                       it could not be computed
 * @param matchedKeyword unsafe phrase found in the query, or {@code null}
 * @param degradations   {@link Degradation#SAFETY_KEYWORD_ONLY} or {@link Degradation#SAFETY_MATRIX_MISSING} when
 *                       the similarity path was skipped
 */
public record SafetyVerdict(boolean unsafe, double similarity, String matchedKeyword, Set<Degradation> degradations) {

    public SafetyVerdict {
        degradations = degradations == null ? Set.of() : Set.copyOf(degradations);
    }

    public Optional<String> keyword() {
        return Optional.ofNullable(matchedKeyword);
    }
}
