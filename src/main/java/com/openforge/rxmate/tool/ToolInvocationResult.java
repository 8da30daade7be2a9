package com.openforge.rxmate.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one dispatch. Always a value: failures are carried in
 * {@code result} under the {@code "error"} key, never thrown.
 *
 * @param name          requested tool name (possibly unknown)
 * @param invocationId  the model's tool_call id this result answers
 * @param result        structured payload handed back to the model
 */
public record ToolInvocationResult(
        String name,
        String invocationId,
        Map<String, Object> result
) {

    public ToolInvocationResult {
        result = result == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    public static ToolInvocationResult error(String name,
                                             String invocationId,
                                             ToolErrorCode code,
                                             String message,
                                             Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", code.name());
        payload.put("tool", name);
        if (details != null) payload.putAll(details);
        payload.put("message", message);
        return new ToolInvocationResult(name, invocationId, payload);
    }

    public boolean isError() {
        return result.get("error") != null;
    }

    /** The error code (registry or domain), or null on success. */
    public String errorCode() {
        Object error = result.get("error");
        return error == null ? null : error.toString();
    }
}
