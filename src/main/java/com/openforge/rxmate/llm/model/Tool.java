package com.openforge.rxmate.llm.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Entry of the request's {@code tools} list. Providers only know the
 * {@code function} kind.
 */
public record Tool(String type, ToolFunction function) {

    private static final String FUNCTION = "function";

    public static Tool function(String name, String description, JsonNode parameters) {
        return new Tool(FUNCTION, new ToolFunction(name, description, parameters));
    }
}
