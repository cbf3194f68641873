package com.smurthy.ai.chatrouter.conversation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Ordered, size-bounded log of turns for one session, oldest first.
 *
 * Holds at most {@code 2 × maxHistoryLength} turns. When an append would exceed the bound the oldest
 * user/assistant pair is evicted first. Not thread-safe: the owning session serialises access.
 */
public class ConversationHistory {

    private final int maxTurns;
    private final Deque<Turn> turns = new ArrayDeque<>();

    public ConversationHistory(int maxHistoryLength) {
        if (maxHistoryLength < 1) {
            throw new IllegalArgumentException("maxHistoryLength must be at least 1");
        }
        this.maxTurns = maxHistoryLength * 2;
    }

    public void append(Turn turn) {
        makeRoomFor(1);
        turns.addLast(turn);
    }

    /**
     * Appends a user turn and the assistant turn answering it, in that order.
     */
    public void appendExchange(Turn userTurn, Turn assistantTurn) {
        if (userTurn.role() != TurnRole.USER || assistantTurn.role() != TurnRole.ASSISTANT) {
            throw new IllegalArgumentException("An exchange is a USER turn followed by an ASSISTANT turn");
        }
        makeRoomFor(2);
        turns.addLast(userTurn);
        turns.addLast(assistantTurn);
    }

    /**
     * The last {@code n} turns, oldest first, as an unmodifiable copy.
     */
    public List<Turn> window(int n) {
        if (n <= 0 || turns.isEmpty()) {
            return List.of();
        }
        List<Turn> all = new ArrayList<>(turns);
        return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
    }

    public List<Turn> turns() {
        return List.copyOf(turns);
    }

    public void reset() {
        turns.clear();
    }

    public int size() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    private void makeRoomFor(int incoming) {
        while (!turns.isEmpty() && turns.size() + incoming > maxTurns) {
            Turn evicted = turns.removeFirst();
            // keep pairs aligned: a user turn takes its answer with it
            if (evicted.role() == TurnRole.USER && !turns.isEmpty() && turns.peekFirst().role() == TurnRole.ASSISTANT) {
                turns.removeFirst();
            }
        }
    }
}
