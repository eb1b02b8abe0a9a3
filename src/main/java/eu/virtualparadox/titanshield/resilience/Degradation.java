package eu.virtualparadox.titanshield.resilience;

/**
 * Degraded-mode markers attached to per-question results for offline auditing.
 * None of them is an error from the caller's point of view: an answer is still produced.
 */
public enum Degradation {
    /** Embedding failed; the safety verdict rests on the keyword scan alone. */
    SAFETY_KEYWORD_ONLY,
    /** No unsafe-intent vectors are loaded; only keywords are checked. */
    SAFETY_MATRIX_MISSING,
    /** Embedding for the semantic leg failed; fusion used the lexical leg only. */
    SEMANTIC_LEG_FAILED,
    /** The lexical leg failed; fusion used the semantic leg only. */
    LEXICAL_LEG_FAILED,
    /** The per-question deadline expired while a retrieval leg was still running. */
    SEARCH_DEADLINE_EXCEEDED,
    /** No option contained a refusal phrase; the LLM fallback was consulted. */
    REFUSAL_KEYWORD_MISS,
    /** The refusal option could not be determined and the first option was chosen. */
    REFUSAL_DEFAULTED,
    /** The answer letter could not be obtained from the LLM and the first option was chosen. */
    ANSWER_DEFAULTED,
    /** The question had no options, so no letter could be produced. */
    NO_OPTIONS
}
