package eu.virtualparadox.titanshield.query;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.query.model.ProcessingResult;
import eu.virtualparadox.titanshield.query.model.Question;
import eu.virtualparadox.titanshield.rag.retriever.model.HybridSearchResult;
import eu.virtualparadox.titanshield.rag.retriever.model.SearchRequest;
import eu.virtualparadox.titanshield.rag.retriever.service.HybridSearchEngine;
import eu.virtualparadox.titanshield.resilience.Degradation;
import eu.virtualparadox.titanshield.routing.RouteDecision;
import eu.virtualparadox.titanshield.routing.RouteMode;
import eu.virtualparadox.titanshield.routing.Router;
import eu.virtualparadox.titanshield.safety.SafetyGuard;
import eu.virtualparadox.titanshield.safety.SafetyVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Screens, routes and, for knowledge questions, retrieves context. Stops right after screening when the question is
 * unsafe. Safe to call from many threads at once.
 */
@Service
@Slf4j
public class QuestionProcessor {

    private final SafetyGuard safetyGuard;
    private final Router router;
    private final HybridSearchEngine searchEngine;
    private final int topK;

    @Autowired
    public QuestionProcessor(final SafetyGuard safetyGuard,
                             final Router router,
                             final HybridSearchEngine searchEngine,
                             final TitanShieldProperties props) {
        this(safetyGuard, router, searchEngine, props.getRetrieval().getTopK());
    }

    public QuestionProcessor(final SafetyGuard safetyGuard,
                             final Router router,
                             final HybridSearchEngine searchEngine,
                             final int topK) {
        this.safetyGuard = safetyGuard;
        this.router = router;
        this.searchEngine = searchEngine;
        this.topK = topK;
    }

    /**
     * @param targetYear year to filter knowledge by; {@code null} to use the year found in the question, if any
     */
    public ProcessingResult processQuery(final Question question, final Integer targetYear) {
        return processQuery(question, targetYear, null);
    }

    /**
     * @param deadline absolute deadline for the safety embedding and retrieval, {@code null} for the configured
     *                 timeouts
     */
    public ProcessingResult processQuery(final Question question, final Integer targetYear, final Instant deadline) {
        final SafetyVerdict verdict = safetyGuard.check(question.text(), deadline);
        final Set<Degradation> degradations = EnumSet.noneOf(Degradation.class);
        degradations.addAll(verdict.degradations());

        if (verdict.unsafe()) {
            return new ProcessingResult(verdict, null, List.of(), degradations);
        }

        final RouteDecision route = router.route(question);
        if (route.mode() != RouteMode.RAG) {
            log.debug("Question {} routed to {} by '{}'", question.id(), route.mode(), route.matchedPattern());
            return new ProcessingResult(verdict, route, List.of(), degradations);
        }

        final Integer year = targetYear != null ? targetYear : route.extractedYear();
        final HybridSearchResult search = searchEngine.search(new SearchRequest(
                question.text(), year, route.entities(), route.categoryHint(), null, topK, deadline));
        degradations.addAll(search.degradations());

        log.debug("Question {} routed to RAG (year={}, entities={}, hint={}): {} chunks",
                question.id(), year, route.entities(), route.categoryHint(), search.chunks().size());
        return new ProcessingResult(verdict, route, search.chunks(), degradations);
    }
}
