package eu.virtualparadox.titanshield.rag.retriever.service;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.application.executor.RetrievalExecutor;
import eu.virtualparadox.titanshield.knowledge.model.Chunk;
import eu.virtualparadox.titanshield.knowledge.store.CandidateFilter;
import eu.virtualparadox.titanshield.knowledge.store.IndexHit;
import eu.virtualparadox.titanshield.knowledge.store.KnowledgeStore;
import eu.virtualparadox.titanshield.rag.embed.EmbeddingClient;
import eu.virtualparadox.titanshield.rag.retriever.model.HybridSearchResult;
import eu.virtualparadox.titanshield.rag.retriever.model.RetrievalSource;
import eu.virtualparadox.titanshield.rag.retriever.model.ScoredChunk;
import eu.virtualparadox.titanshield.rag.retriever.model.SearchRequest;
import eu.virtualparadox.titanshield.resilience.Degradation;
import eu.virtualparadox.titanshield.resilience.DependencyResult;
import eu.virtualparadox.titanshield.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hybrid retriever: lexical BM25 search and semantic vector search run in parallel, are cut by the temporal filter
 * and merged with {@link ReciprocalRankFusion}.
 * <p>
 * Steps:
 * <ol>
 *   <li>Build the candidate filter from the category hint and region</li>
 *   <li>Submit both legs to the retrieval executor and join them against the request deadline</li>
 *   <li>Drop chunks that are not valid in the target year</li>
 *   <li>Fuse by rank and return the top-k</li>
 * </ol>
 * A leg that fails or misses the deadline counts as empty and is reported as a {@link Degradation}; the search itself
 * never throws for dependency or timing problems.
 */
@Service
@Slf4j
public class HybridSearchEngine {

    private final KnowledgeStore knowledgeStore;
    private final EmbeddingClient embeddingClient;
    private final TemporalFilter temporalFilter;
    private final AsyncTaskExecutor retrievalExecutor;
    private final TitanShieldProperties.Retrieval settings;
    private final ReciprocalRankFusion fusion;

    @Autowired
    public HybridSearchEngine(final KnowledgeStore knowledgeStore,
                              final EmbeddingClient embeddingClient,
                              final TemporalFilter temporalFilter,
                              final RetrievalExecutor retrievalExecutor,
                              final TitanShieldProperties props) {
        this(knowledgeStore, embeddingClient, temporalFilter, (AsyncTaskExecutor) retrievalExecutor, props.getRetrieval());
    }

    public HybridSearchEngine(final KnowledgeStore knowledgeStore,
                              final EmbeddingClient embeddingClient,
                              final TemporalFilter temporalFilter,
                              final AsyncTaskExecutor retrievalExecutor,
                              final TitanShieldProperties.Retrieval settings) {
        this.knowledgeStore = knowledgeStore;
        this.embeddingClient = embeddingClient;
        this.temporalFilter = temporalFilter;
        this.retrievalExecutor = retrievalExecutor;
        this.settings = settings;
        this.fusion = new ReciprocalRankFusion(
                settings.getRrfK(), settings.getLexicalWeight(), settings.getSemanticWeight(), temporalFilter);
    }

    /**
     * Plain search over the whole store with the configured timeout.
     */
    public List<ScoredChunk> search(final String queryText,
                                    final Integer targetYear,
                                    final List<String> entities,
                                    final int topK) {
        return search(SearchRequest.of(queryText, targetYear, entities, topK)).chunks();
    }

    public HybridSearchResult search(final SearchRequest request) {
        final Set<Degradation> degradations = EnumSet.noneOf(Degradation.class);
        if (request.topK() <= 0) {
            return HybridSearchResult.empty(degradations);
        }

        final Instant deadline = request.deadline() != null
                ? request.deadline()
                : Instant.now().plus(settings.getSearchTimeout());
        if (!Instant.now().isBefore(deadline)) {
            log.warn("Search started after its deadline; returning no results");
            degradations.add(Degradation.SEARCH_DEADLINE_EXCEEDED);
            return HybridSearchResult.empty(degradations);
        }

        final CandidateFilter filter = new CandidateFilter(request.categoryHint(), request.region());

        final Future<LegOutcome> lexicalFuture = submit(() -> lexicalLeg(request, filter));
        final Future<LegOutcome> semanticFuture = submit(() -> semanticLeg(request, filter, deadline));

        final LegOutcome lexical = join(lexicalFuture, deadline, Degradation.LEXICAL_LEG_FAILED, "lexical");
        final LegOutcome semantic = join(semanticFuture, deadline, Degradation.SEMANTIC_LEG_FAILED, "semantic");
        lexical.degradation().ifPresent(degradations::add);
        semantic.degradation().ifPresent(degradations::add);

        final List<ScoredChunk> lexicalHits = temporalFilter.retainValid(lexical.hits(), request.targetYear());
        final List<ScoredChunk> semanticHits = temporalFilter.retainValid(semantic.hits(), request.targetYear());

        final List<ScoredChunk> fused = fusion.fuse(lexicalHits, semanticHits, request.targetYear(), request.topK());
        printDebugFused(fused);

        return new HybridSearchResult(
                fused, request.targetYear() != null, lexicalHits.size(), semanticHits.size(), degradations);
    }

    private Future<LegOutcome> submit(final Callable<LegOutcome> leg) {
        try {
            return retrievalExecutor.submit(leg);
        } catch (final RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private LegOutcome lexicalLeg(final SearchRequest request, final CandidateFilter filter) throws IOException {
        final List<IndexHit> hits = knowledgeStore.lexicalSearch(
                request.queryText(), request.entities(), filter, settings.getLexicalFanOut());
        return LegOutcome.of(resolve(hits, RetrievalSource.LEXICAL));
    }

    private LegOutcome semanticLeg(final SearchRequest request,
                                   final CandidateFilter filter,
                                   final Instant deadline) throws IOException {
        if (request.queryText().isBlank()) {
            return LegOutcome.of(List.of());
        }

        final Duration remaining = Duration.between(Instant.now(), deadline);
        final Duration budget = remaining.compareTo(settings.getEmbeddingTimeout()) < 0
                ? remaining
                : settings.getEmbeddingTimeout();

        final DependencyResult<float[]> embedding = embeddingClient.embed(request.queryText(), budget);
        if (!embedding.isSuccess()) {
            log.warn("Semantic leg degraded to lexical-only: {}", embedding.failure().describe());
            return LegOutcome.failed(Degradation.SEMANTIC_LEG_FAILED);
        }
        if (!VectorMath.isUsable(embedding.value())) {
            log.warn("Semantic leg degraded to lexical-only: unusable query vector from {}", embeddingClient.name());
            return LegOutcome.failed(Degradation.SEMANTIC_LEG_FAILED);
        }

        final List<IndexHit> hits = knowledgeStore.vectorSearch(embedding.value(), filter, settings.getSemanticFanOut());
        return LegOutcome.of(resolve(hits, RetrievalSource.SEMANTIC));
    }

    private List<ScoredChunk> resolve(final List<IndexHit> hits, final RetrievalSource source) throws IOException {
        final List<ScoredChunk> resolved = new ArrayList<>(hits.size());
        for (final IndexHit hit : hits) {
            final Optional<Chunk> chunk = knowledgeStore.getChunk(hit.chunkId());
            if (chunk.isPresent()) {
                resolved.add(new ScoredChunk(chunk.get(), hit.score(), source));
            } else {
                log.warn("{} hit {} has no stored chunk; skipping", source, hit.chunkId());
            }
        }
        return resolved;
    }

    private LegOutcome join(final Future<LegOutcome> future,
                            final Instant deadline,
                            final Degradation onFailure,
                            final String leg) {
        try {
            final long remainingNanos = Duration.between(Instant.now(), deadline).toNanos();
            return future.get(Math.max(0L, remainingNanos), TimeUnit.NANOSECONDS);
        } catch (final TimeoutException e) {
            future.cancel(true);
            log.warn("{} leg missed the search deadline; continuing without it", leg);
            return LegOutcome.failed(Degradation.SEARCH_DEADLINE_EXCEEDED);
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Search interrupted while waiting for the {} leg", leg);
            return LegOutcome.failed(Degradation.SEARCH_DEADLINE_EXCEEDED);
        } catch (final CancellationException e) {
            return LegOutcome.failed(Degradation.SEARCH_DEADLINE_EXCEEDED);
        } catch (final ExecutionException e) {
            log.warn("{} leg failed; continuing without it", leg, e.getCause());
            return LegOutcome.failed(onFailure);
        }
    }

    private void printDebugFused(final List<ScoredChunk> fused) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final ScoredChunk r : fused) {
            sb.append(" - ").append("[").append(String.format("%.5f", r.score())).append("] ")
                    .append(r.chunkId()).append(" ").append(abbreviate(r.chunk().text())).append("\n");
        }
        log.debug("Fused chunks:\n{}", sb);
    }

    private static String abbreviate(final String text) {
        return text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }

    private record LegOutcome(List<ScoredChunk> hits, Optional<Degradation> degradation) {

        static LegOutcome of(final List<ScoredChunk> hits) {
            return new LegOutcome(hits, Optional.empty());
        }

        static LegOutcome failed(final Degradation degradation) {
            return new LegOutcome(List.of(), Optional.of(degradation));
        }
    }
}
