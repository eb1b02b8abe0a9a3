package eu.virtualparadox.titanshield.rag.embed;

public enum EmbeddingProvider {
    /** Local ONNX model under {@code titanshield.paths.models}. */
    ONNX,
    /** VNPT AI embedding endpoint. */
    VNPT
}
