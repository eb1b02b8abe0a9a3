package eu.virtualparadox.titanshield.query.prompt;

import eu.virtualparadox.titanshield.knowledge.model.Chunk;
import eu.virtualparadox.titanshield.knowledge.model.DocumentType;
import eu.virtualparadox.titanshield.query.model.Question;
import eu.virtualparadox.titanshield.rag.retriever.model.RetrievalSource;
import eu.virtualparadox.titanshield.rag.retriever.model.ScoredChunk;
import eu.virtualparadox.titanshield.routing.RouteMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptFactoryTest {

    private final PromptFactory factory = new PromptFactory();

    private static final Question QUESTION = new Question("q1", "Thủ đô của Việt Nam là gì? 100% chắc chắn?",
            List.of("Hà Nội", "Huế", "Đà Nẵng"));

    @Test
    @DisplayName("RAG prompt numbers the context and lists lettered options")
    void testRagPrompt() {
        List<ScoredChunk> context = List.of(
                new ScoredChunk(Chunk.of("c1", "Hà Nội là thủ đô.", "s", DocumentType.GEOGRAPHY), 0.03, RetrievalSource.FUSED),
                new ScoredChunk(Chunk.of("c2", "Huế là cố đô.", "s", DocumentType.HISTORY), 0.02, RetrievalSource.FUSED));

        AnswerPrompt prompt = factory.build(QUESTION, RouteMode.RAG, context);

        assertTrue(prompt.user().contains("[1] Hà Nội là thủ đô."));
        assertTrue(prompt.user().contains("[2] Huế là cố đô."));
        assertTrue(prompt.user().contains("A) Hà Nội"));
        assertTrue(prompt.user().contains("C) Đà Nẵng"));
        assertTrue(prompt.user().contains("A, B, C"));
        assertTrue(prompt.user().contains("100% chắc chắn"));
        assertTrue(prompt.system().contains("Đáp án"));
    }

    @Test
    @DisplayName("RAG without context falls back to the plain prompt")
    void testPlainPrompt() {
        AnswerPrompt prompt = factory.build(QUESTION, RouteMode.RAG, List.of());

        assertFalse(prompt.user().contains("NGỮ CẢNH"));
        assertTrue(prompt.user().contains("Thủ đô của Việt Nam"));
    }

    @Test
    @DisplayName("READING and STEM prompts differ from each other")
    void testModePrompts() {
        AnswerPrompt reading = factory.build(QUESTION, RouteMode.READING, List.of());
        AnswerPrompt stem = factory.build(QUESTION, RouteMode.STEM, List.of());

        assertTrue(reading.user().contains("đoạn văn"));
        assertTrue(stem.user().contains("từng bước"));
        assertNotEquals(reading.user(), stem.user());
    }
}
