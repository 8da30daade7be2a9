package com.openforge.rxmate.agent.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.rxmate.tool.ToolDescriptor;

import java.util.List;

/** Public view of a registered tool; the handler stays private. */
public record ToolInfo(
        String name,
        String description,
        JsonNode parameters,
        List<String> required
) {

    public static ToolInfo from(ToolDescriptor descriptor) {
        return new ToolInfo(descriptor.name(), descriptor.description(),
                descriptor.parameters(), descriptor.requiredArguments());
    }
}
