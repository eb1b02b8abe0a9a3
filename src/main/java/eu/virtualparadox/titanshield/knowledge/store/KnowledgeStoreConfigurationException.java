package eu.virtualparadox.titanshield.knowledge.store;

/**
 * The knowledge index or the safety matrix cannot be trusted: missing, empty, misaligned or of the wrong dimension.
 * Raised during startup only; the application must not serve questions against such an index.
 */
public class KnowledgeStoreConfigurationException extends RuntimeException {

    public KnowledgeStoreConfigurationException(final String message) {
        super(message);
    }

    public KnowledgeStoreConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
