package eu.virtualparadox.titanshield.rag.llm;

import eu.virtualparadox.titanshield.application.executor.DependencyExecutor;
import eu.virtualparadox.titanshield.resilience.DependencyResult;
import eu.virtualparadox.titanshield.resilience.FailureKind;
import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ChatModelLlmClientTest {

    private static final IntervalFunction FAST_BACKOFF = IntervalFunction.of(Duration.ofMillis(10));

    private DependencyExecutor executor;
    private ChatModel chatModel;

    @BeforeEach
    void setUp() {
        executor = new DependencyExecutor();
        executor.setCorePoolSize(2);
        executor.setThreadNamePrefix("test-llm-");
        executor.initialize();
        chatModel = mock(ChatModel.class);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static ChatResponse reply(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    @DisplayName("Reply text is returned and the system prompt is sent first")
    void testComplete() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("Đáp án: C"));
        ChatModelLlmClient client = new ChatModelLlmClient(chatModel, executor, 0, FAST_BACKOFF);

        DependencyResult<String> result = client.complete("Bạn là trợ lý.", "Câu hỏi?", Duration.ofSeconds(2));

        assertTrue(result.isSuccess());
        assertEquals("Đáp án: C", result.value());
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        assertEquals(2, captor.getValue().getInstructions().size());
        assertInstanceOf(SystemMessage.class, captor.getValue().getInstructions().get(0));
    }

    @Test
    @DisplayName("Blank system prompt is left out")
    void testNoSystemPrompt() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("A"));
        ChatModelLlmClient client = new ChatModelLlmClient(chatModel, executor, 0, FAST_BACKOFF);

        client.complete(" ", "Câu hỏi?", Duration.ofSeconds(2));

        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        assertEquals(1, captor.getValue().getInstructions().size());
    }

    @Test
    @DisplayName("Blank reply fails as an invalid response without retrying")
    void testBlankReply() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("   "));
        ChatModelLlmClient client = new ChatModelLlmClient(chatModel, executor, 2, FAST_BACKOFF);

        DependencyResult<String> result = client.complete(null, "Câu hỏi?", Duration.ofSeconds(2));

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.INVALID_RESPONSE, result.failure().kind());
        verify(chatModel, times(1)).call(any(Prompt.class));
    }

    @Test
    @DisplayName("Transient model failure is retried")
    void testRetry() {
        when(chatModel.call(any(Prompt.class)))
                .thenThrow(new IllegalStateException("connection reset"))
                .thenReturn(reply("B"));
        ChatModelLlmClient client = new ChatModelLlmClient(chatModel, executor, 2, FAST_BACKOFF);

        DependencyResult<String> result = client.complete(null, "Câu hỏi?", Duration.ofSeconds(5));

        assertTrue(result.isSuccess());
        assertEquals("B", result.value());
        verify(chatModel, times(2)).call(any(Prompt.class));
    }
}
