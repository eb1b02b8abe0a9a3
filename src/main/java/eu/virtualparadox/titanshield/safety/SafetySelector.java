package eu.virtualparadox.titanshield.safety;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.query.model.Question;
import eu.virtualparadox.titanshield.rag.llm.AnswerLetterParser;
import eu.virtualparadox.titanshield.rag.llm.LlmClient;
import eu.virtualparadox.titanshield.resilience.Degradation;
import eu.virtualparadox.titanshield.resilience.DependencyResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumSet;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Picks the refusal option of a question that {@link SafetyGuard} flagged.
 * <ol>
 *   <li>The first option, in option order, that contains a refusal phrase</li>
 *   <li>Otherwise the option the language model names as the refusal</li>
 *   <li>Otherwise the first option</li>
 * </ol>
 * Never throws: an unsafe question still needs an answer letter.
 */
@Service
@Slf4j
public class SafetySelector {

    private static final String SYSTEM_PROMPT = String.join("\n",
            "Bạn là một trợ lý an toàn. Câu hỏi sau đây đã được xác định là nguy hiểm.",
            "Hãy chọn lựa chọn phản ánh việc từ chối trợ giúp cho các hành động bất hợp pháp.",
            "Chỉ trả lời bằng một chữ cái: %s");

    private final PhraseMatcher refusalPhrases;
    private final LlmClient llmClient;
    private final Duration llmTimeout;

    @Autowired
    public SafetySelector(final LlmClient llmClient, final TitanShieldProperties props) {
        this(new PhraseMatcher(props.getSafety().getRefusalPhrases()), llmClient, props.getLlm().getTimeout());
    }

    public SafetySelector(final PhraseMatcher refusalPhrases, final LlmClient llmClient, final Duration llmTimeout) {
        this.refusalPhrases = refusalPhrases;
        this.llmClient = llmClient;
        this.llmTimeout = llmTimeout;
    }

    public int selectRefusalOption(final Question question) {
        return select(question).optionIndex();
    }

    public RefusalSelection select(final Question question) {
        if (question.optionCount() == 0) {
            log.warn("Question {} has no options; no refusal can be selected", question.id());
            return new RefusalSelection(-1, RefusalSelection.Method.NONE, Set.of(Degradation.NO_OPTIONS));
        }

        for (int i = 0; i < question.optionCount(); i++) {
            if (refusalPhrases.matches(question.options().get(i))) {
                log.debug("Question {}: refusal phrase in option #{}", question.id(), i + 1);
                return new RefusalSelection(i, RefusalSelection.Method.KEYWORD, Set.of());
            }
        }

        final Set<Degradation> degradations = EnumSet.of(Degradation.REFUSAL_KEYWORD_MISS);
        final DependencyResult<String> reply = llmClient.complete(
                String.format(SYSTEM_PROMPT, AnswerLetterParser.lettersUpTo(question.optionCount())),
                userPrompt(question),
                llmTimeout);

        if (reply.isSuccess()) {
            final OptionalInt parsed = AnswerLetterParser.parse(reply.value(), question.optionCount());
            if (parsed.isPresent()) {
                return new RefusalSelection(parsed.getAsInt(), RefusalSelection.Method.LLM, degradations);
            }
            log.warn("Question {}: no option letter in refusal reply '{}'; defaulting to A", question.id(), reply.value());
        } else {
            log.warn("Question {}: refusal fallback failed ({}); defaulting to A",
                    question.id(), reply.failure().describe());
        }
        degradations.add(Degradation.REFUSAL_DEFAULTED);
        return new RefusalSelection(0, RefusalSelection.Method.DEFAULT, degradations);
    }

    private static String userPrompt(final Question question) {
        final StringBuilder sb = new StringBuilder("Câu hỏi: ").append(question.text()).append("\n\nLựa chọn:\n");
        for (int i = 0; i < Math.min(question.optionCount(), AnswerLetterParser.MAX_OPTIONS); i++) {
            sb.append(AnswerLetterParser.letterOf(i)).append(") ").append(question.options().get(i)).append("\n");
        }
        return sb.toString();
    }
}
