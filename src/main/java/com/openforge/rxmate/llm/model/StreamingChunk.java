package com.openforge.rxmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Payload of one {@code data:} line in a streamed completion. The stream
 * closes with the literal {@code [DONE]}, which is never parsed into this type.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingChunk(String id, String model, List<ChunkChoice> choices) {

    /** Null for keep-alive or usage-only frames. */
    public ChunkChoice firstChoice() {
        if (choices == null || choices.isEmpty()) return null;
        return choices.get(0);
    }

    public record ChunkChoice(int index, DeltaMessage delta, String finishReason) {
    }

    public record DeltaMessage(String role, String content, List<ToolCallDelta> toolCalls) {
    }

    /** Fragment of a tool call; id and name come once, arguments trickle in keyed by index. */
    public record ToolCallDelta(Integer index, String id, String type, FunctionDelta function) {
    }

    public record FunctionDelta(String name, String arguments) {
    }
}
