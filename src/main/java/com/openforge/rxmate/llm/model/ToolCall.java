package com.openforge.rxmate.llm.model;

/**
 * A single tool invocation request produced by the model.
 *
 * The agent loop must:
 *   1. Extract all ToolCalls from the assistant message, in order.
 *   2. Route each one through the ToolRegistry.
 *   3. Append a Message.toolResult(id, json) for each ToolCall back
 *      into the history so the model can continue reasoning.
 */
public record ToolCall(
        String id,
        String type,
        FunctionCallResult function
) {

    public static ToolCall function(String id, String name, String arguments) {
        return new ToolCall(id, "function", new FunctionCallResult(name, arguments));
    }

    public String name() {
        return function == null ? null : function.name();
    }
}
