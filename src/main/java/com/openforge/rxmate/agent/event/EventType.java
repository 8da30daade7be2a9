package com.openforge.rxmate.agent.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discriminator of every stream event; serialized lowercase ("text_delta").
 *
 * Flow of one turn:
 *   (TEXT_DELTA | TOOL_CALL [TOOL_ARGS_DELTA…] TOOL_RESULT)*  [ERROR]  DONE
 */
public enum EventType {

    /** A piece of assistant text, in receipt order. */
    TEXT_DELTA,

    /** Raw argument fragment of a tool call while the model is still producing it. */
    TOOL_ARGS_DELTA,

    /** The agent is about to dispatch a tool. */
    TOOL_CALL,

    /** A dispatch finished; the result may itself be a structured error. */
    TOOL_RESULT,

    /** The completion failed; the turn ends. */
    ERROR,

    /** Always the last event of a turn. */
    DONE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EventType fromWire(String value) {
        for (EventType type : values()) {
            if (type.wireName().equalsIgnoreCase(value)) return type;
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
