package com.smurthy.ai.chatrouter.conversation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TurnRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String wireName;

    TurnRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
