package eu.virtualparadox.titanshield.resilience;

public enum FailureKind {
    TIMEOUT,
    UNAVAILABLE,
    INVALID_RESPONSE,
    INTERRUPTED
}
