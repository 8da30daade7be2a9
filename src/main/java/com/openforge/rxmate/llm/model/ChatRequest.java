package com.openforge.rxmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Body of a chat completion call. Model and temperature are left null by the
 * agent loop and filled in from the provider settings by the client.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        List<Tool> tools,
        String toolChoice,
        Double temperature
) {

    private static final String AUTO = "auto";

    public static ChatRequest withTools(List<Message> messages, List<Tool> tools) {
        boolean offerTools = tools != null && !tools.isEmpty();
        return new ChatRequest(null, messages, offerTools ? tools : null, offerTools ? AUTO : null, null);
    }
}
