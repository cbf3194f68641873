package com.smurthy.ai.chatrouter.service;

import com.smurthy.ai.chatrouter.orchestration.ConversationState;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A session's state plus the lock that serialises everything done to it.
 */
public class ConversationSession {

    private final ConversationState state;
    private final ReentrantLock lock = new ReentrantLock();

    public ConversationSession(ConversationState state) {
        this.state = state;
    }

    /**
     * Run {@code action} while holding the session lock.
     *
     * @throws CycleCancelledException if interrupted while waiting for the lock
     */
    public <T> T withLock(Function<ConversationState, T> action) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CycleCancelledException("Interrupted waiting for session " + state.sessionId(), e);
        }
        try {
            return action.apply(state);
        } finally {
            lock.unlock();
        }
    }
}
