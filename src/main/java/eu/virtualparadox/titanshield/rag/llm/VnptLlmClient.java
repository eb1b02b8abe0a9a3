package eu.virtualparadox.titanshield.rag.llm;

import com.fasterxml.jackson.databind.JsonNode;
import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.application.executor.DependencyExecutor;
import eu.virtualparadox.titanshield.resilience.DependencyCalls;
import eu.virtualparadox.titanshield.resilience.DependencyResult;
import eu.virtualparadox.titanshield.resilience.InvalidResponseException;
import eu.virtualparadox.titanshield.util.VnptRestClients;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link LlmClient} for the VNPT AI chat-completions API.
 * <p>Response shape: {@code {"choices": [{"message": {"content": "..."}}]}}.</p>
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "titanshield.llm", name = "provider", havingValue = "VNPT")
public class VnptLlmClient implements LlmClient {

    private static final String ENDPOINT_PREFIX = "/data-service/v1/chat/completions/vnptai-hackathon-";
    private static final String MODEL_PREFIX = "vnptai_hackathon_";

    private final DependencyExecutor dependencyExecutor;
    private final RestClient restClient;
    private final int maxRetries;
    private final IntervalFunction backoff;
    private final String modelSize;
    private final double temperature;
    private final int maxCompletionTokens;

    @Autowired
    public VnptLlmClient(final DependencyExecutor dependencyExecutor,
                         final TitanShieldProperties props) {
        this(dependencyExecutor,
                VnptRestClients.create(props.getLlm().getVnpt(), props.getLlm().getTimeout()),
                props.getLlm().getMaxRetries(),
                DependencyCalls.exponentialBackoff(),
                props.getLlm());
    }

    VnptLlmClient(final DependencyExecutor dependencyExecutor,
                  final RestClient restClient,
                  final int maxRetries,
                  final IntervalFunction backoff,
                  final TitanShieldProperties.Llm llm) {
        this.dependencyExecutor = dependencyExecutor;
        this.restClient = restClient;
        this.maxRetries = maxRetries;
        this.backoff = backoff;
        this.modelSize = "large".equalsIgnoreCase(llm.getModelSize()) ? "large" : "small";
        this.temperature = llm.getTemperature();
        this.maxCompletionTokens = llm.getMaxCompletionTokens();
        log.info("Using VNPT chat model '{}'", modelSize);
    }

    @Override
    public DependencyResult<String> complete(final String systemPrompt,
                                             final String userPrompt,
                                             final Duration timeout) {
        final List<Map<String, String>> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", userPrompt));

        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", MODEL_PREFIX + modelSize);
        payload.put("messages", messages);
        payload.put("temperature", temperature);
        payload.put("max_completion_tokens", maxCompletionTokens);

        return DependencyCalls.callWithRetry(dependencyExecutor, "vnpt-chat", timeout, maxRetries, backoff, () -> {
            final JsonNode response = restClient.post()
                    .uri(ENDPOINT_PREFIX + modelSize)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
            return parseContent(response);
        });
    }

    static String parseContent(final JsonNode response) {
        final JsonNode choices = response == null ? null : response.path("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw new InvalidResponseException("No choices in VNPT response");
        }
        final String content = choices.path(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new InvalidResponseException("Empty completion in VNPT response");
        }
        return content;
    }
}
