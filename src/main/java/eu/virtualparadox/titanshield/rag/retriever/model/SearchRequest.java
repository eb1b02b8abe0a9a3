package eu.virtualparadox.titanshield.rag.retriever.model;

import eu.virtualparadox.titanshield.knowledge.model.DocumentType;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Input of one hybrid search.
 *
 * @param queryText    free query text
 * @param targetYear   year implied by the question, {@code null} to disable temporal filtering
 * @param entities     salient phrases for the lexical leg
 * @param categoryHint document types to restrict the search to; empty means the whole store
 * @param region       region restriction, {@code null} for none
 * @param topK         number of fused results to return
 * @param deadline     absolute deadline for both legs, {@code null} for the configured search timeout
 */
public record SearchRequest(String queryText,
                            Integer targetYear,
                            List<String> entities,
                            Set<DocumentType> categoryHint,
                            String region,
                            int topK,
                            Instant deadline) {

    public SearchRequest {
        queryText = queryText == null ? "" : queryText;
        entities = entities == null ? List.of() : List.copyOf(entities);
        categoryHint = categoryHint == null ? Set.of() : Set.copyOf(categoryHint);
    }

    public static SearchRequest of(final String queryText,
                                   final Integer targetYear,
                                   final List<String> entities,
                                   final int topK) {
        return new SearchRequest(queryText, targetYear, entities, Set.of(), null, topK, null);
    }
}
