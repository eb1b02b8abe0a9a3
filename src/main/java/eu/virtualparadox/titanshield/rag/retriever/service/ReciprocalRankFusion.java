package eu.virtualparadox.titanshield.rag.retriever.service;

import eu.virtualparadox.titanshield.knowledge.model.Chunk;
import eu.virtualparadox.titanshield.rag.retriever.model.RetrievalSource;
import eu.virtualparadox.titanshield.rag.retriever.model.ScoredChunk;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the lexical and the semantic result lists by rank:
 * {@code RRF(c) = Σ weight_leg / (k + rank_leg(c))} over the legs that contain {@code c}.
 * <p>
 * Only positions matter, so BM25 and cosine scores never need a common scale. Entries with a NaN or negative
 * infinite score are treated as absent and do not take up a rank.
 * <p>
 * Order: RRF score descending, then (with a target year) temporal rank descending, then chunk id ascending.
 */
@Slf4j
public class ReciprocalRankFusion {

    private final int k;
    private final double lexicalWeight;
    private final double semanticWeight;
    private final TemporalFilter temporalFilter;

    public ReciprocalRankFusion(final int k,
                                final double lexicalWeight,
                                final double semanticWeight,
                                final TemporalFilter temporalFilter) {
        if (k < 0) {
            throw new IllegalArgumentException("RRF k must be >= 0");
        }
        this.k = k;
        this.lexicalWeight = lexicalWeight;
        this.semanticWeight = semanticWeight;
        this.temporalFilter = temporalFilter;
    }

    public List<ScoredChunk> fuse(final List<ScoredChunk> lexical,
                                  final List<ScoredChunk> semantic,
                                  final Integer targetYear,
                                  final int topK) {
        if (topK <= 0) {
            return List.of();
        }

        final Map<String, Double> rrfScores = new HashMap<>();
        final Map<String, Chunk> chunks = new LinkedHashMap<>();
        accumulate(lexical, lexicalWeight, rrfScores, chunks);
        accumulate(semantic, semanticWeight, rrfScores, chunks);

        final Comparator<ScoredChunk> order = Comparator
                .comparingDouble(ScoredChunk::score).reversed()
                .thenComparing(Comparator.comparingDouble(
                        (ScoredChunk sc) -> temporalFilter.rank(sc.chunk(), targetYear)).reversed())
                .thenComparing(ScoredChunk::chunkId);

        final List<ScoredChunk> fused = new ArrayList<>(chunks.size());
        for (final Map.Entry<String, Chunk> entry : chunks.entrySet()) {
            fused.add(new ScoredChunk(entry.getValue(), rrfScores.get(entry.getKey()), RetrievalSource.FUSED));
        }
        fused.sort(order);

        log.debug("RRF fused lexical={} semantic={} into {} candidates (k={})",
                lexical.size(), semantic.size(), fused.size(), k);
        return fused.size() > topK ? List.copyOf(fused.subList(0, topK)) : List.copyOf(fused);
    }

    private void accumulate(final List<ScoredChunk> leg,
                            final double weight,
                            final Map<String, Double> rrfScores,
                            final Map<String, Chunk> chunks) {
        final Set<String> seen = new HashSet<>();
        int rank = 0;
        for (final ScoredChunk sc : leg) {
            // a repeated id keeps its best rank only
            if (isAbsent(sc.score()) || !seen.add(sc.chunkId())) {
                continue;
            }
            rank++;
            rrfScores.merge(sc.chunkId(), weight / (k + rank), Double::sum);
            chunks.putIfAbsent(sc.chunkId(), sc.chunk());
        }
    }

    private static boolean isAbsent(final double score) {
        return Double.isNaN(score) || score == Double.NEGATIVE_INFINITY;
    }
}
