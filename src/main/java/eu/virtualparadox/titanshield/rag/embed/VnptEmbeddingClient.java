package eu.virtualparadox.titanshield.rag.embed;

import com.fasterxml.jackson.databind.JsonNode;
import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.application.executor.DependencyExecutor;
import eu.virtualparadox.titanshield.resilience.DependencyCalls;
import eu.virtualparadox.titanshield.resilience.DependencyResult;
import eu.virtualparadox.titanshield.resilience.InvalidResponseException;
import eu.virtualparadox.titanshield.util.VnptRestClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Map;

/**
 * Embeddings from the VNPT AI embedding endpoint.
 * <p>Response shape: {@code {"data": [{"embedding": [...], "index": 0}]}}.</p>
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "titanshield.embedding", name = "provider", havingValue = "VNPT")
public class VnptEmbeddingClient implements EmbeddingClient {

    static final String ENDPOINT = "/data-service/vnptai-hackathon-embedding";
    static final String MODEL = "vnptai_hackathon_embedding";

    private final DependencyExecutor dependencyExecutor;
    private final RestClient restClient;
    private final int dimension;

    @Autowired
    public VnptEmbeddingClient(final DependencyExecutor dependencyExecutor,
                               final TitanShieldProperties props) {
        this(dependencyExecutor,
                VnptRestClients.create(props.getEmbedding().getVnpt(), props.getRetrieval().getEmbeddingTimeout()),
                props.getEmbedding().getDimension());
    }

    VnptEmbeddingClient(final DependencyExecutor dependencyExecutor,
                        final RestClient restClient,
                        final int dimension) {
        this.dependencyExecutor = dependencyExecutor;
        this.restClient = restClient;
        this.dimension = dimension;
        log.info("Using VNPT embedding endpoint, dimension {}", dimension);
    }

    @Override
    public DependencyResult<float[]> embed(final String text, final Duration timeout) {
        return DependencyCalls.call(dependencyExecutor, "vnpt-embed", timeout, () -> request(text));
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String name() {
        return "vnpt";
    }

    private float[] request(final String text) {
        final JsonNode response = restClient.post()
                .uri(ENDPOINT)
                .body(Map.of(
                        "model", MODEL,
                        "input", text == null ? "" : text,
                        "encoding_format", "float"))
                .retrieve()
                .body(JsonNode.class);
        return parseEmbedding(response, dimension);
    }

    static float[] parseEmbedding(final JsonNode response, final int dimension) {
        final JsonNode embedding = response == null ? null : response.path("data").path(0).path("embedding");
        if (embedding == null || !embedding.isArray() || embedding.isEmpty()) {
            throw new InvalidResponseException("No embedding data in VNPT response");
        }
        if (embedding.size() != dimension) {
            throw new InvalidResponseException(
                    "Embedding has dimension " + embedding.size() + ", expected " + dimension);
        }
        final float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            final JsonNode value = embedding.get(i);
            if (!value.isNumber()) {
                throw new InvalidResponseException("Non-numeric embedding component at " + i);
            }
            vector[i] = value.floatValue();
        }
        return vector;
    }
}
