package com.smurthy.ai.chatrouter.orchestration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages of one routing cycle.
 *
 * <pre>
 * START → CLASSIFIED → RETRIEVING → CONTEXT_FORMATTED → GENERATING → RESPONDED → DONE
 *                    ↘ DIRECT_GENERATING ──────────────────────────↗
 * </pre>
 */
public enum RoutingStage {
    START,
    CLASSIFIED,
    RETRIEVING,
    CONTEXT_FORMATTED,
    GENERATING,
    DIRECT_GENERATING,
    RESPONDED,
    DONE;

    public Set<RoutingStage> successors() {
        return switch (this) {
            case START -> EnumSet.of(CLASSIFIED);
            case CLASSIFIED -> EnumSet.of(RETRIEVING, DIRECT_GENERATING);
            case RETRIEVING -> EnumSet.of(CONTEXT_FORMATTED);
            case CONTEXT_FORMATTED -> EnumSet.of(GENERATING);
            case GENERATING, DIRECT_GENERATING -> EnumSet.of(RESPONDED);
            case RESPONDED -> EnumSet.of(DONE);
            case DONE -> EnumSet.noneOf(RoutingStage.class);
        };
    }

    public boolean canAdvanceTo(RoutingStage next) {
        return successors().contains(next);
    }
}
