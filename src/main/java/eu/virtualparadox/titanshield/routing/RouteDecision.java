package eu.virtualparadox.titanshield.routing;

import eu.virtualparadox.titanshield.knowledge.model.DocumentType;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable routing result.
 *
 * @param mode           chosen processing mode
 * @param matchedPattern label of the rule that fired, {@code null} for the RAG default
 * @param extractedYear  year mentioned in a RAG question, or {@code null}
 * @param entities       salient phrases of a RAG question, in order of appearance
 * @param categoryHint   document types a RAG question is about; empty when unknown
 */
public record RouteDecision(RouteMode mode,
                            String matchedPattern,
                            Integer extractedYear,
                            List<String> entities,
                            Set<DocumentType> categoryHint) {

    public RouteDecision {
        entities = entities == null ? List.of() : List.copyOf(entities);
        categoryHint = categoryHint == null ? Set.of() : Set.copyOf(categoryHint);
    }

    static RouteDecision of(final RouteMode mode, final String matchedPattern) {
        return new RouteDecision(mode, matchedPattern, null, List.of(), Set.of());
    }

    public Optional<Integer> year() {
        return Optional.ofNullable(extractedYear);
    }
}
