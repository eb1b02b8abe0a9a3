package eu.virtualparadox.titanshield.knowledge.index;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.knowledge.store.KnowledgeStoreConfigurationException;
import eu.virtualparadox.titanshield.knowledge.store.LuceneKnowledgeStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Fills an empty index from the configured chunk artifact, then verifies the index before any question is served.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KnowledgeBootstrap {

    private final LuceneKnowledgeStore knowledgeStore;
    private final KnowledgeIngestService ingestService;
    private final TitanShieldProperties props;

    @PostConstruct
    public void prepare() throws IOException {
        final Path artifact = props.getPaths().getChunks();
        if (knowledgeStore.size() == 0) {
            if (artifact == null || !Files.isRegularFile(artifact)) {
                throw new KnowledgeStoreConfigurationException(
                        "Knowledge index is empty and no chunk artifact is configured (titanshield.paths.chunks)");
            }
            ingestService.ingest(artifact);
        } else if (artifact != null) {
            log.info("Knowledge index already populated; skipping artifact {}", artifact);
        }
        knowledgeStore.verifyIntegrity(props.getEmbedding().getDimension());
    }
}
