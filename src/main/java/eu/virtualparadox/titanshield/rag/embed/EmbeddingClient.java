package eu.virtualparadox.titanshield.rag.embed;

import eu.virtualparadox.titanshield.resilience.DependencyResult;

import java.time.Duration;

/**
 * Turns text into a fixed-length vector.
 * <p>
 * Every vector produced during the lifetime of a process has {@link #dimension()} components. Failures, including
 * timeouts, are returned as values and never thrown.
 */
public interface EmbeddingClient {

    DependencyResult<float[]> embed(String text, Duration timeout);

    int dimension();

    /**
     * Short provider name for logs.
     */
    String name();
}
