package com.smurthy.ai.chatrouter.conversation;

import java.util.Objects;

/**
 * One role-tagged message kept in conversation history.
 */
public record Turn(TurnRole role, String content) {

    public Turn {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
    }

    public static Turn user(String content) {
        return new Turn(TurnRole.USER, content);
    }

    public static Turn assistant(String content) {
        return new Turn(TurnRole.ASSISTANT, content);
    }
}
