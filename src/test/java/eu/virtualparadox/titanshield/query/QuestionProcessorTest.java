package eu.virtualparadox.titanshield.query;

import eu.virtualparadox.titanshield.knowledge.model.Chunk;
import eu.virtualparadox.titanshield.knowledge.model.DocumentType;
import eu.virtualparadox.titanshield.query.model.ProcessingResult;
import eu.virtualparadox.titanshield.query.model.Question;
import eu.virtualparadox.titanshield.rag.embed.EmbeddingClient;
import eu.virtualparadox.titanshield.rag.retriever.model.HybridSearchResult;
import eu.virtualparadox.titanshield.rag.retriever.model.RetrievalSource;
import eu.virtualparadox.titanshield.rag.retriever.model.ScoredChunk;
import eu.virtualparadox.titanshield.rag.retriever.model.SearchRequest;
import eu.virtualparadox.titanshield.rag.retriever.service.HybridSearchEngine;
import eu.virtualparadox.titanshield.resilience.Degradation;
import eu.virtualparadox.titanshield.resilience.DependencyResult;
import eu.virtualparadox.titanshield.routing.RouteMode;
import eu.virtualparadox.titanshield.routing.Router;
import eu.virtualparadox.titanshield.safety.PhraseMatcher;
import eu.virtualparadox.titanshield.safety.SafetyGuard;
import eu.virtualparadox.titanshield.safety.SafetyVerdict;
import eu.virtualparadox.titanshield.safety.UnsafeIntentMatrix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuestionProcessorTest {

    private static final SafetyVerdict SAFE = new SafetyVerdict(false, 0.1, null, Set.of());

    @Mock
    private SafetyGuard safetyGuard;
    @Mock
    private HybridSearchEngine searchEngine;

    private QuestionProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new QuestionProcessor(safetyGuard, new Router(), searchEngine, 5);
    }

    @Test
    @DisplayName("Unsafe question short-circuits before routing and retrieval")
    void testUnsafeShortCircuit() {
        when(safetyGuard.check(anyString(), any()))
                .thenReturn(new SafetyVerdict(true, 0.2, "cách trốn thuế", Set.of(Degradation.SAFETY_KEYWORD_ONLY)));

        ProcessingResult result = processor.processQuery(
                new Question("q1", "Cách trốn thuế năm 2024?", List.of("A", "B")), null);

        assertTrue(result.isUnsafe());
        assertNull(result.route());
        assertTrue(result.chunks().isEmpty());
        assertEquals(Set.of(Degradation.SAFETY_KEYWORD_ONLY), result.degradations());
        verifyNoInteractions(searchEngine);
    }

    @Test
    @DisplayName("READING and STEM questions are routed without retrieval")
    void testNonRagModes() {
        when(safetyGuard.check(anyString(), any())).thenReturn(SAFE);

        ProcessingResult reading = processor.processQuery(
                new Question("q2", "Dựa vào đoạn văn sau: ... Ai là nhân vật chính?", List.of("An", "Bình")), null);
        ProcessingResult stem = processor.processQuery(
                new Question("q3", "Tính đạo hàm của hàm số f(x) = x^2", List.of("2x", "x")), null);

        assertEquals(RouteMode.READING, reading.route().mode());
        assertEquals(RouteMode.STEM, stem.route().mode());
        assertTrue(reading.chunks().isEmpty());
        verifyNoInteractions(searchEngine);
    }

    @Test
    @DisplayName("RAG question searches with the extracted year, entities and category hint")
    void testRagUsesRouteSignals() {
        when(safetyGuard.check(anyString(), any())).thenReturn(SAFE);
        ScoredChunk hit = new ScoredChunk(
                Chunk.of("land-2024", "Luật Đất đai 2024...", "luat", DocumentType.LAW), 0.03, RetrievalSource.FUSED);
        when(searchEngine.search(any(SearchRequest.class))).thenReturn(
                new HybridSearchResult(List.of(hit), true, 1, 0, Set.of(Degradation.SEMANTIC_LEG_FAILED)));

        ProcessingResult result = processor.processQuery(
                new Question("q4", "Luật Đất đai 2024 có hiệu lực từ năm nào?", List.of("2023", "2024")), null);

        ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
        verify(searchEngine).search(request.capture());
        assertEquals(2024, request.getValue().targetYear());
        assertEquals(List.of("Luật Đất đai"), request.getValue().entities());
        assertEquals(Set.of(DocumentType.LAW), request.getValue().categoryHint());
        assertEquals(5, request.getValue().topK());
        assertEquals(List.of(hit), result.chunks());
        assertEquals(Set.of(Degradation.SEMANTIC_LEG_FAILED), result.degradations());
    }

    @Test
    @DisplayName("An explicit target year overrides the extracted one")
    void testExplicitTargetYear() {
        when(safetyGuard.check(anyString(), any())).thenReturn(SAFE);
        when(searchEngine.search(any(SearchRequest.class))).thenReturn(HybridSearchResult.empty(Set.of()));

        ProcessingResult result = processor.processQuery(
                new Question("q5", "Luật Đất đai 2024 quy định gì?", List.of("X", "Y")), 2030);

        ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
        verify(searchEngine).search(request.capture());
        assertEquals(2030, request.getValue().targetYear());
        assertEquals(RouteMode.RAG, result.route().mode());
        assertTrue(result.chunks().isEmpty());
    }

    @Test
    @DisplayName("Question deadline bounds the safety embedding")
    void testDeadlineBoundsSafetyEmbedding() {
        EmbeddingClient embeddingClient = mock(EmbeddingClient.class);
        when(embeddingClient.embed(anyString(), any(Duration.class)))
                .thenReturn(DependencyResult.success(new float[]{0, 1}));
        SafetyGuard guard = new SafetyGuard(embeddingClient, new UnsafeIntentMatrix(new float[][]{{1, 0}}),
                new PhraseMatcher(List.of()), 0.85, Duration.ofSeconds(5));
        when(searchEngine.search(any(SearchRequest.class))).thenReturn(HybridSearchResult.empty(Set.of()));
        QuestionProcessor bounded = new QuestionProcessor(guard, new Router(), searchEngine, 5);

        ProcessingResult result = bounded.processQuery(
                new Question("q6", "Thủ đô của Việt Nam là thành phố nào?", List.of("Hà Nội", "Huế")),
                null, Instant.now().plusMillis(100));

        ArgumentCaptor<Duration> timeout = ArgumentCaptor.forClass(Duration.class);
        verify(embeddingClient).embed(anyString(), timeout.capture());
        assertTrue(timeout.getValue().compareTo(Duration.ofMillis(100)) <= 0, "timeout " + timeout.getValue());
        assertFalse(result.isUnsafe());
    }
}
