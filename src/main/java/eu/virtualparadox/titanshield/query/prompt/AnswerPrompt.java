package eu.virtualparadox.titanshield.query.prompt;

/**
 * System instructions and user message for one answer request.
 */
public record AnswerPrompt(String system, String user) {
}
