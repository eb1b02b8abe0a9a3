package eu.virtualparadox.titanshield.rag.llm;

public enum LlmProvider {
    /** Spring AI {@code ChatModel} backed by a local Ollama server. */
    OLLAMA,
    /** VNPT AI chat-completions endpoint. */
    VNPT
}
