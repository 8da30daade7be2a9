package com.openforge.rxmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/** Name, hint and JSON Schema of one callable tool. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolFunction(String name, String description, JsonNode parameters) {
}
