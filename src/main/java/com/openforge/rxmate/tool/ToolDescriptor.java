package com.openforge.rxmate.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.rxmate.llm.model.Tool;

import java.util.List;
import java.util.Objects;

/**
 * Static registration metadata of one tool.
 *
 * @param name               unique key, used as the function name towards the model
 * @param description        natural-language hint for the model
 * @param parameters         JSON Schema of the arguments, sent verbatim
 * @param requiredArguments  names that must be present, in declaration order
 * @param handler            the domain function
 */
public record ToolDescriptor(
        String name,
        String description,
        JsonNode parameters,
        List<String> requiredArguments,
        ToolHandler handler
) {

    public ToolDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(handler, "handler for " + name);
        requiredArguments = requiredArguments == null ? List.of() : List.copyOf(requiredArguments);
    }

    /** The model-facing definition: schema only, no handler. */
    public Tool toTool() {
        return Tool.function(name, description, parameters);
    }
}
