package eu.virtualparadox.titanshield.rag.llm;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.application.executor.DependencyExecutor;
import eu.virtualparadox.titanshield.resilience.DependencyCalls;
import eu.virtualparadox.titanshield.resilience.DependencyResult;
import eu.virtualparadox.titanshield.resilience.InvalidResponseException;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link LlmClient} over a Spring AI {@link ChatModel}.
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "titanshield.llm", name = "provider", havingValue = "OLLAMA", matchIfMissing = true)
public class ChatModelLlmClient implements LlmClient {

    private final ChatModel chatModel;
    private final DependencyExecutor dependencyExecutor;
    private final int maxRetries;
    private final IntervalFunction backoff;

    @Autowired
    public ChatModelLlmClient(final ChatModel chatModel,
                              final DependencyExecutor dependencyExecutor,
                              final TitanShieldProperties props) {
        this(chatModel, dependencyExecutor, props.getLlm().getMaxRetries(),
                DependencyCalls.exponentialBackoff());
    }

    ChatModelLlmClient(final ChatModel chatModel,
                       final DependencyExecutor dependencyExecutor,
                       final int maxRetries,
                       final IntervalFunction backoff) {
        this.chatModel = chatModel;
        this.dependencyExecutor = dependencyExecutor;
        this.maxRetries = maxRetries;
        this.backoff = backoff;
    }

    @Override
    public DependencyResult<String> complete(final String systemPrompt,
                                             final String userPrompt,
                                             final Duration timeout) {
        final List<Message> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(new SystemMessage(systemPrompt));
        }
        messages.add(new UserMessage(userPrompt));
        final Prompt prompt = new Prompt(messages);

        return DependencyCalls.callWithRetry(dependencyExecutor, "chat-model", timeout, maxRetries, backoff, () -> {
            final String text = chatModel.call(prompt)
                    .getResult()
                    .getOutput()
                    .getText();
            if (text == null || text.isBlank()) {
                throw new InvalidResponseException("Empty completion");
            }
            return text;
        });
    }
}
