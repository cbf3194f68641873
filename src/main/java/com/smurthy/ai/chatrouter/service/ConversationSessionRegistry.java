package com.smurthy.ai.chatrouter.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.smurthy.ai.chatrouter.config.ConversationConfig;
import com.smurthy.ai.chatrouter.conversation.ConversationHistory;
import com.smurthy.ai.chatrouter.orchestration.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * In-memory sessions keyed by session id. Nothing is persisted.
 * <p>
 * A session not touched within {@code app.conversation.session-idle-timeout} expires with its history,
 * and the registry never holds more than {@code app.conversation.max-sessions}.
 */
@Component
public class ConversationSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConversationSessionRegistry.class);

    private final Cache<String, ConversationSession> sessions;
    private final ConversationConfig config;

    @Autowired
    public ConversationSessionRegistry(ConversationConfig config) {
        this(config, Ticker.systemTicker());
    }

    ConversationSessionRegistry(ConversationConfig config, Ticker ticker) {
        this.config = config;
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(config.sessionIdleTimeout())
                .maximumSize(config.maxSessions())
                .ticker(ticker)
                .removalListener((String id, ConversationSession session, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        log.info("Session {} dropped ({})", id, cause);
                    }
                })
                .build();
    }

    public ConversationSession getOrCreate(String sessionId) {
        return sessions.get(sessionId, id -> {
            log.debug("Opening session {} (max {} turns)", id, config.maxTurns());
            return new ConversationSession(
                    new ConversationState(id, new ConversationHistory(config.maxHistoryLength())));
        });
    }

    public Optional<ConversationSession> find(String sessionId) {
        return Optional.ofNullable(sessions.getIfPresent(sessionId));
    }

    public boolean remove(String sessionId) {
        return sessions.asMap().remove(sessionId) != null;
    }
}
