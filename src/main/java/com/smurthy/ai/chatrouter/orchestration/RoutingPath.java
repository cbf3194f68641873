package com.smurthy.ai.chatrouter.orchestration;

import com.smurthy.ai.chatrouter.classifier.QueryLabel;

/**
 * How a cycle produces its answer. Chosen once per cycle from the classification label.
 */
public enum RoutingPath {
    /** Retrieve, format context, then generate grounded in it. */
    KNOWLEDGE_BASE,
    DIRECT,
    GREETING,
    /** Ask the user to rephrase. */
    CLARIFICATION;

    public static RoutingPath forLabel(QueryLabel label) {
        return switch (label) {
            case RAG_REQUIRED -> KNOWLEDGE_BASE;
            case DIRECT_ANSWER -> DIRECT;
            case GREETING -> GREETING;
            case UNCLEAR -> CLARIFICATION;
        };
    }
}
