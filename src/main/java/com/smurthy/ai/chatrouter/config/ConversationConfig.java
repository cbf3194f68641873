package com.smurthy.ai.chatrouter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Conversation history settings.
 *
 * @param maxHistoryLength      number of exchanges (user + assistant pairs) kept per session
 * @param classifierWindowTurns turns handed to the classifier as recent history
 * @param historyInPrompt       whether prior turns are replayed to the generation backend
 * @param promptHistoryTurns    upper bound on replayed turns
 * @param sessionIdleTimeout    a session untouched for this long is dropped with its history
 * @param maxSessions           upper bound on sessions held in memory
 */
@ConfigurationProperties(prefix = "app.conversation")
public record ConversationConfig(
        @DefaultValue("5") int maxHistoryLength,
        @DefaultValue("2") int classifierWindowTurns,
        @DefaultValue("true") boolean historyInPrompt,
        @DefaultValue("10") int promptHistoryTurns,
        @DefaultValue("30m") Duration sessionIdleTimeout,
        @DefaultValue("10000") long maxSessions
) {
    public ConversationConfig {
        if (maxHistoryLength < 1) {
            throw new IllegalArgumentException("app.conversation.max-history-length must be at least 1");
        }
        if (sessionIdleTimeout == null || sessionIdleTimeout.isNegative() || sessionIdleTimeout.isZero()) {
            throw new IllegalArgumentException("app.conversation.session-idle-timeout must be positive");
        }
    }

    public int maxTurns() {
        return maxHistoryLength * 2;
    }
}
