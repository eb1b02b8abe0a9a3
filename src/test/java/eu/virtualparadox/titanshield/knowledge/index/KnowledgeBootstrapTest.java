package eu.virtualparadox.titanshield.knowledge.index;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.knowledge.InMemoryKnowledgeIndex;
import eu.virtualparadox.titanshield.knowledge.model.Chunk;
import eu.virtualparadox.titanshield.knowledge.model.DocumentType;
import eu.virtualparadox.titanshield.knowledge.store.KnowledgeStoreConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class KnowledgeBootstrapTest {

    @TempDir
    Path tempDir;

    private InMemoryKnowledgeIndex index;
    private KnowledgeIngestService ingestService;
    private TitanShieldProperties props;

    @BeforeEach
    void setUp() throws IOException {
        index = new InMemoryKnowledgeIndex();
        ingestService = mock(KnowledgeIngestService.class);
        props = new TitanShieldProperties();
        props.getEmbedding().setDimension(2);
    }

    @AfterEach
    void tearDown() throws IOException {
        index.close();
    }

    private void fillIndex() throws IOException {
        index.add(List.of(Chunk.of("c1", "Luật Đất đai 2024", "luat", DocumentType.LAW)),
                List.of(new float[]{1, 0}));
    }

    @Test
    @DisplayName("Empty index without an artifact fails startup")
    void testEmptyWithoutArtifact() {
        KnowledgeBootstrap bootstrap = new KnowledgeBootstrap(index.store(), ingestService, props);

        assertThrows(KnowledgeStoreConfigurationException.class, bootstrap::prepare);
        verifyNoInteractions(ingestService);
    }

    @Test
    @DisplayName("Empty index is filled from the artifact and then verified")
    void testIngestsArtifact() throws IOException {
        Path artifact = tempDir.resolve("chunks.jsonl");
        Files.writeString(artifact, "{}\n");
        props.getPaths().setChunks(artifact);
        when(ingestService.ingest(any(Path.class))).thenAnswer(invocation -> {
            fillIndex();
            return 1;
        });

        new KnowledgeBootstrap(index.store(), ingestService, props).prepare();

        verify(ingestService).ingest(artifact);
        assertEquals(1, index.store().size());
    }

    @Test
    @DisplayName("Populated index skips ingestion")
    void testPopulatedIndexSkipsIngest() throws IOException {
        fillIndex();
        props.getPaths().setChunks(tempDir.resolve("chunks.jsonl"));

        new KnowledgeBootstrap(index.store(), ingestService, props).prepare();

        verifyNoInteractions(ingestService);
    }

    @Test
    @DisplayName("Index of another dimension fails verification")
    void testDimensionMismatch() throws IOException {
        fillIndex();
        props.getEmbedding().setDimension(1024);

        assertThrows(KnowledgeStoreConfigurationException.class,
                () -> new KnowledgeBootstrap(index.store(), ingestService, props).prepare());
    }
}
