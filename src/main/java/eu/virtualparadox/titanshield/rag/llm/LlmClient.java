package eu.virtualparadox.titanshield.rag.llm;

import eu.virtualparadox.titanshield.resilience.DependencyResult;

import java.time.Duration;

/**
 * Text completion by an external language model. Failures, including timeouts, are returned as values.
 */
public interface LlmClient {

    /**
     * @param systemPrompt instructions, may be {@code null}
     * @param userPrompt   the actual request
     * @param timeout      budget for the whole call including retries
     */
    DependencyResult<String> complete(String systemPrompt, String userPrompt, Duration timeout);

    default DependencyResult<String> complete(final String prompt, final Duration timeout) {
        return complete(null, prompt, timeout);
    }
}
