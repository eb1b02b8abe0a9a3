package eu.virtualparadox.titanshield.rag.retriever.model;

import eu.virtualparadox.titanshield.resilience.Degradation;

import java.util.List;
import java.util.Set;

/**
 * Fused results of one search together with what went wrong on the way.
 *
 * @param chunks                fused chunks, best first; possibly empty
 * @param temporalFilterApplied whether a target year restricted the legs
 * @param lexicalCount          leg size after temporal exclusion
 * @param semanticCount         leg size after temporal exclusion
 * @param degradations          degraded paths taken, empty on a clean run
 */
public record HybridSearchResult(List<ScoredChunk> chunks,
                                 boolean temporalFilterApplied,
                                 int lexicalCount,
                                 int semanticCount,
                                 Set<Degradation> degradations) {

    public HybridSearchResult {
        chunks = List.copyOf(chunks);
        degradations = Set.copyOf(degradations);
    }

    public static HybridSearchResult empty(final Set<Degradation> degradations) {
        return new HybridSearchResult(List.of(), false, 0, 0, degradations);
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }
}
