package eu.virtualparadox.titanshield.routing;

public enum RouteMode {
    /** The question carries its own passage; answer from it. */
    READING,
    /** Calculation or formula work; answer by reasoning, no retrieval. */
    STEM,
    /** Knowledge question; answer from retrieved chunks. */
    RAG
}
