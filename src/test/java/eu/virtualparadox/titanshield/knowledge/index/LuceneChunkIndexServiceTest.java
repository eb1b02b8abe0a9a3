package eu.virtualparadox.titanshield.knowledge.index;

import eu.virtualparadox.titanshield.knowledge.InMemoryKnowledgeIndex;
import eu.virtualparadox.titanshield.knowledge.model.Chunk;
import eu.virtualparadox.titanshield.knowledge.model.DocumentType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LuceneChunkIndexServiceTest {

    private InMemoryKnowledgeIndex index;
    private LuceneChunkIndexService service;

    @BeforeEach
    void setUp() throws IOException {
        index = new InMemoryKnowledgeIndex();
        service = index.indexService();
    }

    @AfterEach
    void tearDown() throws IOException {
        index.close();
    }

    private static Chunk chunk(String id, String source) {
        return Chunk.of(id, "nội dung " + id, source, DocumentType.GENERAL);
    }

    @Test
    @DisplayName("Upsert replaces every chunk of the same source")
    void testUpsertReplacesSource() throws IOException {
        service.upsert("doc", List.of(chunk("a", "doc"), chunk("b", "doc")),
                List.of(new float[]{1, 0}, new float[]{0, 1}));
        service.upsert("doc", List.of(chunk("c", "doc")), List.of(new float[]{1, 1}));

        assertEquals(1, index.store().size());
        assertTrue(index.store().getChunk("c").isPresent());
        assertTrue(index.store().getChunk("a").isEmpty());
    }

    @Test
    @DisplayName("deleteBySource removes only that source")
    void testDeleteBySource() throws IOException {
        service.upsert("one", List.of(chunk("a", "one")), List.of(new float[]{1, 0}));
        service.upsert("two", List.of(chunk("b", "two")), List.of(new float[]{0, 1}));

        service.deleteBySource("one");

        assertEquals(1, index.store().size());
        assertTrue(index.store().getChunk("b").isPresent());
    }

    @Test
    @DisplayName("A chunk id written again under another source replaces the earlier document")
    void testSameIdAcrossSources() throws IOException {
        service.upsert("old", List.of(new Chunk("x", "luật cũ", "old", DocumentType.LAW, 1900, 2000, Chunk.REGION_ALL)),
                List.of(new float[]{1, 0}));
        service.upsert("new", List.of(new Chunk("x", "luật mới", "new", DocumentType.LAW, 2020, 9999, Chunk.REGION_ALL)),
                List.of(new float[]{0, 1}));

        assertEquals(1, index.store().size());
        Chunk stored = index.store().getChunk("x").orElseThrow();
        assertEquals(2020, stored.validFrom());
        assertEquals("new", stored.source());
        assertDoesNotThrow(() -> index.store().verifyIntegrity(2));
    }

    @Test
    @DisplayName("Repeated chunk id within one batch is rejected")
    void testDuplicateIdInBatch() {
        assertThrows(IllegalArgumentException.class, () -> service.upsert("doc",
                List.of(chunk("a", "doc"), chunk("a", "doc")), List.of(new float[]{1, 0}, new float[]{0, 1})));
    }

    @Test
    @DisplayName("Chunk and vector counts must match")
    void testSizeMismatch() {
        assertThrows(IllegalArgumentException.class, () -> service.upsert("doc",
                List.of(chunk("a", "doc"), chunk("b", "doc")), List.of(new float[]{1, 0})));
    }

    @Test
    @DisplayName("Empty or blank input is rejected")
    void testEmptyInput() {
        assertThrows(IllegalArgumentException.class, () -> service.upsert(" ", List.of(chunk("a", "x")),
                List.of(new float[]{1})));
        assertThrows(IllegalArgumentException.class, () -> service.upsert("doc", List.of(), List.of()));
    }

    @Test
    @DisplayName("Vectors must share one dimension, within and across batches")
    void testDimensionConsistency() throws IOException {
        assertThrows(IllegalArgumentException.class, () -> service.upsert("doc",
                List.of(chunk("a", "doc"), chunk("b", "doc")), List.of(new float[]{1, 0}, new float[]{1, 0, 0})));

        service.upsert("doc", List.of(chunk("a", "doc")), List.of(new float[]{1, 0}));
        assertThrows(IllegalArgumentException.class, () -> service.upsert("other",
                List.of(chunk("b", "other")), List.of(new float[]{1, 0, 0})));
    }

    @Test
    @DisplayName("Null vector is rejected")
    void testNullVector() {
        List<float[]> vectors = new ArrayList<>();
        vectors.add(new float[]{1, 0});
        vectors.add(null);
        assertThrows(IllegalArgumentException.class, () -> service.upsert("doc",
                List.of(chunk("a", "doc"), chunk("b", "doc")), vectors));
    }
}
