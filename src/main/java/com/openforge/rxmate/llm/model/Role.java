package com.openforge.rxmate.llm.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Author of a {@link Message}. Serialized lower-case, as the
 * OpenAI-compatible wire format and the chat client expect.
 */
public enum Role {

    /** Instructions prepended by the agent loop; never part of caller history. */
    SYSTEM,
    USER,
    ASSISTANT,
    /** Result of a tool invocation; carries {@code tool_call_id}. */
    TOOL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromWire(String value) {
        if (value == null) return null;
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
