package com.openforge.rxmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.util.List;

/**
 * Conversation entry, both on the chat API and towards the model.
 * An assistant entry may hold tool calls instead of text; a tool entry
 * holds the JSON result and the id of the call it answers.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Message(
        @NotNull
        Role role,
        String content,
        List<ToolCall> toolCalls,
        String toolCallId
) {

    public static Message system(String content) {
        return new Message(Role.SYSTEM, content, null, null);
    }

    public static Message user(String content) {
        return new Message(Role.USER, content, null, null);
    }

    public static Message assistantText(String content) {
        return new Message(Role.ASSISTANT, content, null, null);
    }

    public static Message assistantToolCalls(String content, List<ToolCall> toolCalls) {
        return new Message(Role.ASSISTANT, content, toolCalls, null);
    }

    public static Message toolResult(String toolCallId, String resultJson) {
        return new Message(Role.TOOL, resultJson, null, toolCallId);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
