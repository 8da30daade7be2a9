package com.openforge.rxmate.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One record of the client-facing stream protocol.
 *
 * Only the fields relevant to the {@code type} are set; the rest are null
 * and omitted on the wire:
 *
 *   text_delta       delta
 *   tool_args_delta  call_id, delta
 *   tool_call        name, call_id, arguments
 *   tool_result      name, call_id, result
 *   error            error.message
 *   done             –
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentEvent(
        EventType type,
        String delta,
        String name,
        @JsonProperty("call_id") String callId,
        Map<String, Object> arguments,
        Map<String, Object> result,
        ErrorPayload error
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static AgentEvent textDelta(String delta) {
        return new AgentEvent(EventType.TEXT_DELTA, delta, null, null, null, null, null);
    }

    public static AgentEvent toolArgsDelta(String callId, String fragment) {
        return new AgentEvent(EventType.TOOL_ARGS_DELTA, fragment, null, callId, null, null, null);
    }

    public static AgentEvent toolCall(String name, String callId, Map<String, Object> arguments) {
        return new AgentEvent(EventType.TOOL_CALL, null, name, callId, arguments, null, null);
    }

    public static AgentEvent toolResult(String name, String callId, Map<String, Object> result) {
        return new AgentEvent(EventType.TOOL_RESULT, null, name, callId, null, result, null);
    }

    public static AgentEvent error(String message) {
        return new AgentEvent(EventType.ERROR, null, null, null, null, null, new ErrorPayload(message));
    }

    public static AgentEvent done() {
        return new AgentEvent(EventType.DONE, null, null, null, null, null, null);
    }

    public record ErrorPayload(String message) {}
}
