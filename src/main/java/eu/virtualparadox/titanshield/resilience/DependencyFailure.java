package eu.virtualparadox.titanshield.resilience;

/**
 * Describes why a call to an external dependency (embedding service, LLM) did not produce a value.
 *
 * @param operation short name of the failed call, for logs
 * @param kind      failure category
 * @param message   human-readable detail
 */
public record DependencyFailure(String operation, FailureKind kind, String message) {

    /**
     * Only unavailability is retried. A timeout has already spent the budget, and malformed responses or
     * interruption will not improve on a second attempt.
     */
    public boolean isRetryable() {
        return kind == FailureKind.UNAVAILABLE;
    }

    public String describe() {
        return operation + " " + kind + ": " + message;
    }
}
