package com.smurthy.ai.chatrouter.generation;

import com.smurthy.ai.chatrouter.config.GenerationConfig;
import com.smurthy.ai.chatrouter.service.BackendCallExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GenerationClient.
 */
@ExtendWith(MockitoExtension.class)
class GenerationClientTest {

    private static final List<Message> MESSAGES = List.of(
            new SystemMessage("You are a helpful assistant."),
            new UserMessage("What's the weather?"));

    @Mock
    private ChatModel chatModel;

    private ExecutorService executor;
    private GenerationClient generationClient;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        generationClient = newClient(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should return the trimmed completion")
    void testGenerate() {
        // Given
        when(chatModel.call(any(Prompt.class))).thenReturn(response("  It is sunny.\n"));
        ArgumentCaptor<Prompt> promptCaptor = ArgumentCaptor.forClass(Prompt.class);

        // When
        String text = generationClient.generate(MESSAGES);

        // Then
        assertThat(text).isEqualTo("It is sunny.");
        verify(chatModel).call(promptCaptor.capture());
        assertThat(promptCaptor.getValue().getInstructions()).hasSize(2);
    }

    @Test
    @DisplayName("Should treat a blank completion as unavailable")
    void testBlankCompletion() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("   "));

        assertThatThrownBy(() -> generationClient.generate(MESSAGES))
                .isExactlyInstanceOf(GenerationUnavailableException.class);
    }

    @Test
    @DisplayName("Should wrap backend errors as unavailable")
    void testBackendError() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new ResourceAccessException("Connection refused"));

        assertThatThrownBy(() -> generationClient.generate(MESSAGES))
                .isExactlyInstanceOf(GenerationUnavailableException.class)
                .hasMessageContaining("Connection refused")
                .hasCauseInstanceOf(ResourceAccessException.class);
    }

    @Test
    @DisplayName("Should report an HTTP read timeout as a generation timeout")
    void testClientSideTimeout() {
        when(chatModel.call(any(Prompt.class)))
                .thenThrow(new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out")));

        assertThatThrownBy(() -> generationClient.generate(MESSAGES))
                .isInstanceOf(GenerationTimeoutException.class);
    }

    @Test
    @DisplayName("Should cancel a call that misses its deadline")
    void testDeadline() {
        // Given
        generationClient = newClient(Duration.ofMillis(100));
        CountDownLatch release = new CountDownLatch(1);
        when(chatModel.call(any(Prompt.class))).thenAnswer(invocation -> {
            release.await();
            return response("too late");
        });

        // When / Then
        try {
            assertThatThrownBy(() -> generationClient.generate(MESSAGES))
                    .isInstanceOf(GenerationTimeoutException.class)
                    .hasMessageContaining("timed out after 100ms");
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("Should reject an empty message list")
    void testEmptyMessages() {
        assertThatThrownBy(() -> generationClient.generate(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(chatModel);
    }

    private GenerationClient newClient(Duration timeout) {
        return new GenerationClient(chatModel, new BackendCallExecutor(executor), new GenerationConfig(timeout, "ollama"));
    }

    private static ChatResponse response(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }
}
