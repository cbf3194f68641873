package com.smurthy.ai.chatrouter.classifier;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Routing label assigned to an utterance.
 *
 * Tie-break priority, highest first: GREETING, RAG_REQUIRED, DIRECT_ANSWER, UNCLEAR.
 */
public enum QueryLabel {
    GREETING(0),
    RAG_REQUIRED(1),
    DIRECT_ANSWER(2),
    UNCLEAR(3);

    private static final List<QueryLabel> BY_PRIORITY = Arrays.stream(values())
            .sorted(Comparator.comparingInt(QueryLabel::priority))
            .toList();

    private final int priority;

    QueryLabel(int priority) {
        this.priority = priority;
    }

    /**
     * Lower value wins a tie.
     */
    public int priority() {
        return priority;
    }

    public static List<QueryLabel> byPriority() {
        return BY_PRIORITY;
    }
}
