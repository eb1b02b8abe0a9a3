package eu.virtualparadox.titanshield.rag.retriever.model;

/**
 * Which result list a {@link ScoredChunk} came from.
 */
public enum RetrievalSource {
    LEXICAL,
    SEMANTIC,
    FUSED
}
