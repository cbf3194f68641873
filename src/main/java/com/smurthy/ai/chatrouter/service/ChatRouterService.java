package com.smurthy.ai.chatrouter.service;

import com.smurthy.ai.chatrouter.conversation.Turn;
import com.smurthy.ai.chatrouter.orchestration.CycleResult;
import com.smurthy.ai.chatrouter.orchestration.RoutingOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;

import java.util.List;

/**
 * Entry point for callers: one routing cycle per {@link #handle} call.
 *
 * Calls for the same session are serialised; different sessions proceed in parallel.
 */
@Service
public class ChatRouterService {

    private static final Logger log = LoggerFactory.getLogger(ChatRouterService.class);

    private final RoutingOrchestrator orchestrator;
    private final ConversationSessionRegistry sessions;

    public ChatRouterService(RoutingOrchestrator orchestrator, ConversationSessionRegistry sessions) {
        this.orchestrator = orchestrator;
        this.sessions = sessions;
    }

    /**
     * Answer {@code utterance} within the given session.
     *
     * @throws IllegalArgumentException if the session id or utterance is blank
     * @throws CycleCancelledException  if the calling thread is interrupted; history is left unchanged
     */
    public CycleResult handle(String sessionId, String utterance) {
        Assert.hasText(sessionId, "sessionId must not be blank");
        Assert.hasText(utterance, "utterance must not be blank");

        ConversationSession session = sessions.getOrCreate(sessionId);
        return session.withLock(state -> orchestrator.runCycle(state, utterance.trim()));
    }

    /**
     * Clear the session's history, keeping the session itself. Unknown sessions are ignored.
     */
    public void reset(String sessionId) {
        Assert.hasText(sessionId, "sessionId must not be blank");
        sessions.find(sessionId).ifPresent(session -> session.withLock(state -> {
            state.history().reset();
            return null;
        }));
        log.info("Conversation history cleared for session {}", sessionId);
    }

    public List<Turn> history(String sessionId) {
        Assert.hasText(sessionId, "sessionId must not be blank");
        return sessions.find(sessionId)
                .map(session -> session.withLock(state -> state.history().turns()))
                .orElse(List.of());
    }

    /**
     * Forget the session entirely.
     *
     * @return whether a session was removed
     */
    public boolean end(String sessionId) {
        Assert.hasText(sessionId, "sessionId must not be blank");
        boolean removed = sessions.remove(sessionId);
        if (removed) {
            log.info("Session {} ended", sessionId);
        }
        return removed;
    }
}
