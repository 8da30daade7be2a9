package com.openforge.rxmate.tool;

import com.openforge.rxmate.llm.model.Tool;
import com.openforge.rxmate.stats.ToolUsageCounter;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Name → handler table for every tool the agent may call.
 *
 * Built once at startup from an explicit list of {@link ToolDescriptor}s and
 * immutable afterwards, so an unknown name is a plain lookup miss.
 *
 * {@link #dispatch} never throws. Unknown names, missing required arguments,
 * handler timeouts and handler exceptions all come back as a structured
 * error result that the agent loop feeds to the model like any other result.
 * Every dispatch counts towards the tool's usage statistics, whatever its
 * outcome.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolDescriptor> descriptors;
    private final ToolUsageCounter usageCounter;
    private final TimeLimiter      toolTimeLimiter;
    private final ExecutorService  toolExecutor;

    public ToolRegistry(List<ToolDescriptor> tools,
                        ToolUsageCounter usageCounter,
                        TimeLimiter toolTimeLimiter,
                        ExecutorService toolExecutor) {
        Map<String, ToolDescriptor> table = new LinkedHashMap<>();
        for (ToolDescriptor tool : tools) {
            if (table.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + tool.name());
            }
            log.info("[ToolRegistry] Registered tool [{}] required={}", tool.name(), tool.requiredArguments());
        }
        this.descriptors     = Collections.unmodifiableMap(table);
        this.usageCounter    = usageCounter;
        this.toolTimeLimiter = toolTimeLimiter;
        this.toolExecutor    = toolExecutor;
        log.info("[ToolRegistry] {} tool(s) registered", table.size());
    }

    // ── Read side ────────────────────────────────────────────────────────────

    public Collection<ToolDescriptor> descriptors() {
        return descriptors.values();
    }

    /** Model-facing tool definitions, in registration order. */
    public List<Tool> toolDefinitions() {
        return descriptors.values().stream().map(ToolDescriptor::toTool).toList();
    }

    // ── Dispatch ─────────────────────────────────────────────────────────────

    public ToolInvocationResult dispatch(String name, Map<String, ?> arguments) {
        return dispatch(name, arguments, "call_" + UUID.randomUUID());
    }

    public ToolInvocationResult dispatch(String name, Map<String, ?> arguments, String invocationId) {
        recordUsage(name);

        ToolDescriptor tool = name == null ? null : descriptors.get(name);
        if (tool == null) {
            log.warn("[ToolRegistry] Unknown tool [{}] requested (call {})", name, invocationId);
            return ToolInvocationResult.error(name, invocationId, ToolErrorCode.UNKNOWN_TOOL,
                    "No tool named '%s'. Available tools: %s".formatted(name, descriptors.keySet()),
                    null);
        }

        ToolArguments args = ToolArguments.of(arguments);
        for (String required : tool.requiredArguments()) {
            if (!args.has(required)) {
                log.warn("[ToolRegistry] [{}] missing required argument '{}' (call {})",
                        name, required, invocationId);
                return ToolInvocationResult.error(name, invocationId,
                        ToolErrorCode.MISSING_REQUIRED_ARGUMENT,
                        "Missing required argument '%s' for tool '%s'".formatted(required, name),
                        Map.of("argument", required));
            }
        }

        log.info("[ToolRegistry] Executing [{}] call={} args={}", name, invocationId, args);
        long started = System.nanoTime();
        ToolInvocationResult result = invoke(tool, args, invocationId);
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        if (result.isError()) {
            log.info("[ToolRegistry] [{}] answered with error {} in {} ms (call {})",
                    name, result.errorCode(), elapsedMs, invocationId);
        } else {
            log.debug("[ToolRegistry] [{}] finished in {} ms", name, elapsedMs);
        }
        return result;
    }

    private ToolInvocationResult invoke(ToolDescriptor tool, ToolArguments args, String invocationId) {
        Callable<Map<String, Object>> timed = TimeLimiter.decorateFutureSupplier(toolTimeLimiter,
                () -> toolExecutor.submit(() -> tool.handler().handle(args)));
        try {
            return new ToolInvocationResult(tool.name(), invocationId, timed.call());
        } catch (TimeoutException e) {
            log.warn("[ToolRegistry] [{}] timed out after {} (call {})", tool.name(),
                    toolTimeLimiter.getTimeLimiterConfig().getTimeoutDuration(), invocationId);
            return ToolInvocationResult.error(tool.name(), invocationId, ToolErrorCode.TOOL_TIMEOUT,
                    "Tool '%s' did not respond in time".formatted(tool.name()), null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolInvocationResult.error(tool.name(), invocationId, ToolErrorCode.TOOL_FAILED,
                    "Tool '%s' was interrupted".formatted(tool.name()), null);
        } catch (Exception e) {
            log.error("[ToolRegistry] [{}] threw unexpectedly (call {})", tool.name(), invocationId, e);
            return ToolInvocationResult.error(tool.name(), invocationId, ToolErrorCode.TOOL_FAILED,
                    "Tool '%s' failed: %s".formatted(tool.name(), e.getMessage()), null);
        }
    }

    /** Best-effort: statistics never affect the dispatch outcome. */
    private void recordUsage(String name) {
        try {
            usageCounter.increment(name == null ? "<null>" : name);
        } catch (RuntimeException e) {
            log.warn("[ToolRegistry] Failed to record usage of [{}]: {}", name, e.getMessage(), e);
        }
    }
}
