package eu.virtualparadox.titanshield.query;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.query.model.Prediction;
import eu.virtualparadox.titanshield.query.model.ProcessingResult;
import eu.virtualparadox.titanshield.query.model.Question;
import eu.virtualparadox.titanshield.query.prompt.AnswerPrompt;
import eu.virtualparadox.titanshield.query.prompt.PromptFactory;
import eu.virtualparadox.titanshield.rag.llm.AnswerLetterParser;
import eu.virtualparadox.titanshield.rag.llm.LlmClient;
import eu.virtualparadox.titanshield.rag.retriever.model.ScoredChunk;
import eu.virtualparadox.titanshield.resilience.Degradation;
import eu.virtualparadox.titanshield.resilience.DependencyResult;
import eu.virtualparadox.titanshield.routing.RouteMode;
import eu.virtualparadox.titanshield.safety.RefusalSelection;
import eu.virtualparadox.titanshield.safety.SafetySelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Answers one question end to end: {@link QuestionProcessor} first, then either the refusal selection or a
 * mode-specific prompt to the language model. Always yields a letter for a question that has options.
 */
@Service
@Slf4j
public class AnswerPipeline {

    private final QuestionProcessor questionProcessor;
    private final SafetySelector safetySelector;
    private final PromptFactory promptFactory;
    private final LlmClient llmClient;
    private final Duration questionDeadline;
    private final Duration llmTimeout;

    @Autowired
    public AnswerPipeline(final QuestionProcessor questionProcessor,
                          final SafetySelector safetySelector,
                          final PromptFactory promptFactory,
                          final LlmClient llmClient,
                          final TitanShieldProperties props) {
        this(questionProcessor, safetySelector, promptFactory, llmClient,
                props.getPipeline().getQuestionDeadline(), props.getLlm().getTimeout());
    }

    public AnswerPipeline(final QuestionProcessor questionProcessor,
                          final SafetySelector safetySelector,
                          final PromptFactory promptFactory,
                          final LlmClient llmClient,
                          final Duration questionDeadline,
                          final Duration llmTimeout) {
        this.questionProcessor = questionProcessor;
        this.safetySelector = safetySelector;
        this.promptFactory = promptFactory;
        this.llmClient = llmClient;
        this.questionDeadline = questionDeadline;
        this.llmTimeout = llmTimeout;
    }

    public Prediction answer(final Question question) {
        final Instant deadline = Instant.now().plus(questionDeadline);
        final ProcessingResult processed = questionProcessor.processQuery(question, null, deadline);
        final Set<Degradation> degradations = EnumSet.noneOf(Degradation.class);
        degradations.addAll(processed.degradations());

        if (processed.isUnsafe()) {
            final RefusalSelection refusal = safetySelector.select(question);
            degradations.addAll(refusal.degradations());
            final Prediction prediction = new Prediction(
                    question.id(), letter(refusal.optionIndex()), Prediction.ROUTE_SAFETY, degradations);
            log.info("Question {} answered {} by refusal selection ({})",
                    question.id(), prediction.answer(), refusal.method());
            return prediction;
        }

        final RouteMode mode = processed.route().mode();
        if (question.optionCount() == 0) {
            log.warn("Question {} has no options; no answer letter", question.id());
            degradations.add(Degradation.NO_OPTIONS);
            return new Prediction(question.id(), null, mode.name(), degradations);
        }

        printDebugContext(question, processed.chunks());
        final AnswerPrompt prompt = promptFactory.build(question, mode, processed.chunks());
        final DependencyResult<String> reply = llmClient.complete(prompt.system(), prompt.user(), remaining(deadline));

        int optionIndex = 0;
        if (reply.isSuccess()) {
            final OptionalInt parsed = AnswerLetterParser.parse(reply.value(), question.optionCount());
            if (parsed.isPresent()) {
                optionIndex = parsed.getAsInt();
            } else {
                log.warn("Question {}: no option letter in reply; defaulting to A", question.id());
                degradations.add(Degradation.ANSWER_DEFAULTED);
            }
        } else {
            log.warn("Question {}: answer generation failed ({}); defaulting to A",
                    question.id(), reply.failure().describe());
            degradations.add(Degradation.ANSWER_DEFAULTED);
        }

        final Prediction prediction = new Prediction(question.id(), letter(optionIndex), mode.name(), degradations);
        log.info("Question {} answered {} via {}{}", question.id(), prediction.answer(), mode,
                degradations.isEmpty() ? "" : " (degraded: " + degradations + ")");
        return prediction;
    }

    private Duration remaining(final Instant deadline) {
        final Duration left = Duration.between(Instant.now(), deadline);
        return left.compareTo(llmTimeout) < 0 ? left : llmTimeout;
    }

    private static String letter(final int optionIndex) {
        return optionIndex < 0 ? null : AnswerLetterParser.letterOf(optionIndex);
    }

    private void printDebugContext(final Question question, final List<ScoredChunk> chunks) {
        if (!log.isDebugEnabled() || chunks.isEmpty()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final ScoredChunk c : chunks) {
            sb.append(" - ").append("[").append(c.chunkId()).append("] ").append(c.chunk().text()).append("\n");
        }
        log.debug("Context for question {}:\n{}", question.id(), sb);
    }
}
