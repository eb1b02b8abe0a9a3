package eu.virtualparadox.titanshield.query.model;

import eu.virtualparadox.titanshield.rag.retriever.model.ScoredChunk;
import eu.virtualparadox.titanshield.resilience.Degradation;
import eu.virtualparadox.titanshield.routing.RouteDecision;
import eu.virtualparadox.titanshield.safety.SafetyVerdict;

import java.util.List;
import java.util.Set;

/**
 * What the core decided about one question before any answer is generated.
 *
 * @param verdict      safety screening result
 * @param route        routing decision, {@code null} when the question was unsafe
 * @param chunks       retrieved context, empty unless routed to RAG
 * @param degradations every degraded path taken while processing
 */
public record ProcessingResult(SafetyVerdict verdict,
                               RouteDecision route,
                               List<ScoredChunk> chunks,
                               Set<Degradation> degradations) {

    public ProcessingResult {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        degradations = degradations == null ? Set.of() : Set.copyOf(degradations);
    }

    public boolean isUnsafe() {
        return verdict.unsafe();
    }
}
