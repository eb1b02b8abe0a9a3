package eu.virtualparadox.titanshield.query.model;

import eu.virtualparadox.titanshield.resilience.Degradation;

import java.util.Set;

/**
 * Final answer for one question.
 *
 * @param qid          question identifier
 * @param answer       option letter, {@code null} only for a question without options
 * @param route        {@code SAFETY}, {@code READING}, {@code STEM} or {@code RAG}
 * @param degradations degraded paths taken
 */
public record Prediction(String qid, String answer, String route, Set<Degradation> degradations) {

    public static final String ROUTE_SAFETY = "SAFETY";
    public static final String ROUTE_ERROR = "ERROR";

    public Prediction {
        degradations = degradations == null ? Set.of() : Set.copyOf(degradations);
    }
}
