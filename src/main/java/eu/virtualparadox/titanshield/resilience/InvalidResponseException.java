package eu.virtualparadox.titanshield.resilience;

/**
 * Thrown inside a dependency call when the remote side answered but the payload is unusable
 * (missing fields, wrong vector dimension, empty completion). Mapped to {@link FailureKind#INVALID_RESPONSE}
 * by {@link DependencyCalls} and never retried.
 */
public class InvalidResponseException extends RuntimeException {

    public InvalidResponseException(final String message) {
        super(message);
    }
}
