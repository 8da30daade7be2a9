package com.openforge.rxmate.llm.model;

/**
 * Target and arguments of a requested call, e.g.
 * {@code check_stock_availability} with {@code {"med_id":"MED002","store_id":"ST001"}}.
 * Arguments stay an unparsed JSON string until the agent loop decodes them.
 */
public record FunctionCallResult(String name, String arguments) {

    public boolean hasArguments() {
        return arguments != null && !arguments.isBlank();
    }
}
