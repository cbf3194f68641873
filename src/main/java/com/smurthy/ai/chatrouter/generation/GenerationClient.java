package com.smurthy.ai.chatrouter.generation;

import com.smurthy.ai.chatrouter.config.GenerationConfig;
import com.smurthy.ai.chatrouter.service.BackendCallExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Chat completion under a deadline.
 *
 * Transient errors are retried by the chat model itself, which shares the application RetryTemplate;
 * this class only bounds the whole call and classifies what went wrong.
 */
@Component
public class GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(GenerationClient.class);

    private final ChatModel chatModel;
    private final BackendCallExecutor backendCalls;
    private final GenerationConfig config;

    public GenerationClient(ChatModel chatModel, BackendCallExecutor backendCalls, GenerationConfig config) {
        this.chatModel = chatModel;
        this.backendCalls = backendCalls;
        this.config = config;
    }

    /**
     * @return the trimmed completion text, never blank
     * @throws GenerationTimeoutException     when the deadline passes first
     * @throws GenerationUnavailableException on any other failure or an empty completion
     */
    public String generate(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
        Prompt prompt = new Prompt(messages);

        long start = System.currentTimeMillis();
        ChatResponse response = call(prompt);
        String text = extractText(response);
        if (!StringUtils.hasText(text)) {
            throw new GenerationUnavailableException("Chat model " + config.backendName() + " returned an empty completion");
        }

        log.debug("Generated {} chars from {} messages in {}ms",
                text.length(), messages.size(), System.currentTimeMillis() - start);
        return text.trim();
    }

    private ChatResponse call(Prompt prompt) {
        try {
            return backendCalls.call("generation", () -> chatModel.call(prompt), config.timeout());
        } catch (TimeoutException e) {
            throw new GenerationTimeoutException(
                    "Chat model " + config.backendName() + " timed out after " + config.timeout().toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (isTimeout(cause)) {
                throw new GenerationTimeoutException(
                        "Chat model " + config.backendName() + " timed out: " + cause.getMessage(), cause);
            }
            throw new GenerationUnavailableException(
                    "Chat model " + config.backendName() + " unavailable: " + cause.getMessage(), cause);
        }
    }

    private static String extractText(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return null;
        }
        return response.getResult().getOutput().getText();
    }

    // The HTTP client may time out before our deadline does
    private static boolean isTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException
                    || current instanceof TimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
