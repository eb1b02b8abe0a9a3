package eu.virtualparadox.titanshield.safety;

import eu.virtualparadox.titanshield.resilience.Degradation;

import java.util.Set;

/**
 * The option chosen for an unsafe question.
 *
 * @param optionIndex  zero-based option index, {@code -1} only when the question has no options
 * @param method       how the option was found
 * @param degradations fallbacks taken on the way
 */
public record RefusalSelection(int optionIndex, Method method, Set<Degradation> degradations) {

    public enum Method {
        /** An option contains a refusal phrase. */
        KEYWORD,
        /** The language model picked the option. */
        LLM,
        /** Nothing usable; the first option was taken. */
        DEFAULT,
        /** The question has no options. */
        NONE
    }

    public RefusalSelection {
        degradations = degradations == null ? Set.of() : Set.copyOf(degradations);
    }
}
