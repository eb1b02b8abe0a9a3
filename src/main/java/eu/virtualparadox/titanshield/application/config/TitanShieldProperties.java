package eu.virtualparadox.titanshield.application.config;

import eu.virtualparadox.titanshield.rag.embed.EmbeddingProvider;
import eu.virtualparadox.titanshield.rag.llm.LlmProvider;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration tree, bound from {@code titanshield.*}.
 * <p>Components take the group they need through their constructor and never look anything up at call time.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "titanshield")
@Getter
@Setter
public class TitanShieldProperties {

    private Paths paths = new Paths();
    private Safety safety = new Safety();
    private Retrieval retrieval = new Retrieval();
    private Embedding embedding = new Embedding();
    private Llm llm = new Llm();
    private Pipeline pipeline = new Pipeline();
    private Run run = new Run();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (paths.index != null) Files.createDirectories(paths.index);
        if (paths.models != null) Files.createDirectories(paths.models);
    }

    @Getter
    @Setter
    public static class Paths {
        private Path index;
        /** JSON array of float arrays; built from the seed questions when absent. */
        private Path safetyMatrix;
        private Path models;
        /** JSONL chunk artifact, ingested only into an empty index. */
        private Path chunks;
    }

    @Getter
    @Setter
    public static class Safety {
        private double threshold = 0.85;
        private Duration embeddingTimeout = Duration.ofSeconds(5);
        /** Lists are populated from {@code application.yml}. */
        private List<String> unsafeKeywords = new ArrayList<>();
        private List<String> refusalPhrases = new ArrayList<>();
        private List<String> seedQuestions = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Retrieval {
        private int topK = 5;
        private int lexicalFanOut = 20;
        private int semanticFanOut = 20;
        private int rrfK = 60;
        private double lexicalWeight = 1.0;
        private double semanticWeight = 1.0;
        private float entityBoost = 2.0f;
        private Duration embeddingTimeout = Duration.ofSeconds(5);
        private Duration searchTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Embedding {
        private EmbeddingProvider provider = EmbeddingProvider.ONNX;
        /** Expected vector size; the index and the safety matrix are checked against it on startup. */
        private int dimension = 1024;
        private Vnpt vnpt = new Vnpt();
    }

    @Getter
    @Setter
    public static class Llm {
        private LlmProvider provider = LlmProvider.OLLAMA;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRetries = 3;
        private double temperature = 0.0;
        private int maxCompletionTokens = 512;
        /** {@code small} or {@code large}. */
        private String modelSize = "small";
        private Vnpt vnpt = new Vnpt();
    }

    @Getter
    @Setter
    public static class Vnpt {
        private String baseUrl = "https://api.idg.vnpt.vn";
        private String authorization;
        private String tokenId;
        private String tokenKey;
    }

    @Getter
    @Setter
    public static class Pipeline {
        private int maxConcurrentQuestions = 4;
        private Duration questionDeadline = Duration.ofSeconds(120);
    }

    /**
     * Batch prediction run, started only when {@code input} is set.
     */
    @Getter
    @Setter
    public static class Run {
        private Path input;
        private Path output = Path.of("predictions.json");
        /** {@code qid,answer} CSV; not written when unset. */
        private Path submission;
    }
}
