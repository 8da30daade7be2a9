package com.openforge.rxmate.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.rxmate.agent.event.AgentEvent;
import com.openforge.rxmate.agent.event.EventSink;
import com.openforge.rxmate.llm.CompletionClient;
import com.openforge.rxmate.llm.CompletionListener;
import com.openforge.rxmate.llm.model.ChatRequest;
import com.openforge.rxmate.llm.model.ChatResponse;
import com.openforge.rxmate.llm.model.Message;
import com.openforge.rxmate.llm.model.ToolCall;
import com.openforge.rxmate.tool.ToolInvocationResult;
import com.openforge.rxmate.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * The agent's turn loop.
 *
 * Loop shape:
 *   while rounds < max-tool-rounds:
 *     1. THINK  : stream one completion over the history, re-emitting text as text_delta
 *     2. DECIDE : no tool calls? → append the answer, done
 *     3. ACT    : for each tool call, in order: tool_call → dispatch → tool_result,
 *                  appending one tool message per call
 *     4. CHECK  : count the round; stop at the bound
 *
 * A failed completion (provider error, timeout, open circuit, malformed
 * response) ends the turn with one error event followed by done. Tool
 * failures never do: the registry already turned them into result data.
 *
 * The loop holds no state between turns. The caller's history is copied and
 * only ever appended to; the system prompt is prepended to each completion
 * request and never stored in the history.
 */
@Slf4j
@Service
public class AgentLoopService {

    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {};

    private final CompletionClient completionClient;
    private final ToolRegistry     toolRegistry;
    private final ObjectMapper     objectMapper;
    private final AgentProperties.Loop config;
    private final ExecutorService  toolBatchExecutor;
    private final String           systemPrompt;

    public AgentLoopService(CompletionClient completionClient,
                            ToolRegistry toolRegistry,
                            ObjectMapper objectMapper,
                            AgentProperties properties,
                            ExecutorService toolBatchExecutor) {
        this.completionClient  = completionClient;
        this.toolRegistry      = toolRegistry;
        this.objectMapper      = objectMapper;
        this.config            = properties.loop();
        this.toolBatchExecutor = toolBatchExecutor;
        this.systemPrompt      = readPrompt(config);
    }

    // ── Entry point ──────────────────────────────────────────────────────────

    public TurnResult runTurn(List<Message> history, EventSink sink) {
        String turnId = UUID.randomUUID().toString().substring(0, 8);
        List<Message> conversation = new ArrayList<>(history);
        StringBuilder turnText = new StringBuilder();
        TurnState state = TurnState.AWAITING_COMPLETION;
        int rounds = 0;

        log.info("[Agent:{}] Turn started. history={} max-tool-rounds={}",
                turnId, history.size(), config.maxToolRounds());

        while (!state.isFinal()) {
            if (!sink.isOpen()) {
                log.info("[Agent:{}] Client went away before round {}; stopping.", turnId, rounds + 1);
                state = TurnState.CANCELLED;
                break;
            }

            // ── THINK ────────────────────────────────────────────────────────
            ChatRequest request = ChatRequest.withTools(withSystemPrompt(conversation),
                    toolRegistry.toolDefinitions());
            Message reply;
            try {
                ChatResponse response = completionClient.complete(request, new TurnListener(sink, turnText));
                reply = response.firstMessage();
            } catch (RuntimeException e) {
                log.warn("[Agent:{}] Completion failed in round {}: {}", turnId, rounds + 1, e.getMessage());
                sink.emit(AgentEvent.error(errorMessage(e)));
                sink.emit(AgentEvent.done());
                state = TurnState.ABORTED;
                break;
            }

            // ── DECIDE ───────────────────────────────────────────────────────
            if (!reply.hasToolCalls()) {
                state = transition(turnId, state, TurnState.STREAMING_TEXT);
                conversation.add(Message.assistantText(reply.content() == null ? "" : reply.content()));
                sink.emit(AgentEvent.done());
                state = transition(turnId, state, TurnState.TERMINATED);
                log.info("[Agent:{}] Answered after {} tool round(s).", turnId, rounds);
                break;
            }

            // ── ACT ──────────────────────────────────────────────────────────
            state = transition(turnId, state, TurnState.HANDLING_TOOL_CALLS);
            List<ToolCall> calls = withCallIds(reply.toolCalls());
            conversation.add(Message.assistantToolCalls(reply.content(), calls));
            log.info("[Agent:{}] Round {}: {} tool call(s) {}", turnId, rounds + 1, calls.size(),
                    calls.stream().map(ToolCall::name).toList());

            boolean delivered = config.parallelToolCalls() && calls.size() > 1
                    ? handleInParallel(turnId, calls, conversation, sink)
                    : handleInSequence(turnId, calls, conversation, sink);
            if (!delivered) {
                state = TurnState.CANCELLED;
                break;
            }

            // ── CHECK ────────────────────────────────────────────────────────
            rounds++;
            if (rounds >= config.maxToolRounds()) {
                log.warn("[Agent:{}] Max tool rounds ({}) reached; ending turn.", turnId, config.maxToolRounds());
                sink.emit(AgentEvent.done());
                state = transition(turnId, state, TurnState.TERMINATED);
            } else {
                state = transition(turnId, state, TurnState.AWAITING_COMPLETION);
            }
        }

        log.info("[Agent:{}] Turn ended: state={} rounds={} text-length={}",
                turnId, state, rounds, turnText.length());
        return new TurnResult(state, Message.assistantText(turnText.toString()),
                List.copyOf(conversation), rounds);
    }

    // ── Tool handling ────────────────────────────────────────────────────────

    private boolean handleInSequence(String turnId, List<ToolCall> calls,
                                     List<Message> conversation, EventSink sink) {
        for (ToolCall call : calls) {
            if (!sink.isOpen()) {
                log.info("[Agent:{}] Client went away; skipping remaining tool calls.", turnId);
                return false;
            }
            Map<String, Object> arguments = parseArguments(turnId, call);
            sink.emit(AgentEvent.toolCall(call.name(), call.id(), arguments));

            ToolInvocationResult result = toolRegistry.dispatch(call.name(), arguments, call.id());
            if (!deliver(turnId, result, conversation, sink)) return false;
        }
        return true;
    }

    /**
     * Dispatches every call of the round concurrently, then reports and
     * appends the results strictly in request order.
     */
    private boolean handleInParallel(String turnId, List<ToolCall> calls,
                                     List<Message> conversation, EventSink sink) {
        List<CompletableFuture<ToolInvocationResult>> pending = new ArrayList<>();
        for (ToolCall call : calls) {
            Map<String, Object> arguments = parseArguments(turnId, call);
            sink.emit(AgentEvent.toolCall(call.name(), call.id(), arguments));
            pending.add(CompletableFuture.supplyAsync(
                    () -> toolRegistry.dispatch(call.name(), arguments, call.id()), toolBatchExecutor));
        }
        boolean delivered = true;
        for (CompletableFuture<ToolInvocationResult> future : pending) {
            ToolInvocationResult result = future.join();
            if (delivered) {
                delivered = deliver(turnId, result, conversation, sink);
            } else {
                logDiscarded(turnId, result);
            }
        }
        return delivered;
    }

    private boolean deliver(String turnId, ToolInvocationResult result,
                            List<Message> conversation, EventSink sink) {
        if (!sink.isOpen()) {
            logDiscarded(turnId, result);
            return false;
        }
        sink.emit(AgentEvent.toolResult(result.name(), result.invocationId(), result.result()));
        conversation.add(Message.toolResult(result.invocationId(), toJson(result.result())));
        return true;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static TurnState transition(String turnId, TurnState from, TurnState to) {
        log.debug("[Agent:{}] {} → {}", turnId, from, to);
        return to;
    }

    private List<Message> withSystemPrompt(List<Message> conversation) {
        List<Message> messages = new ArrayList<>(conversation.size() + 1);
        messages.add(Message.system(systemPrompt));
        messages.addAll(conversation);
        return messages;
    }

    /** Providers occasionally omit the call id; tool messages must still reference one. */
    private static List<ToolCall> withCallIds(List<ToolCall> calls) {
        List<ToolCall> normalized = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            normalized.add(call.id() == null || call.id().isBlank()
                    ? ToolCall.function("call_" + UUID.randomUUID(), call.name(),
                            call.function() == null ? null : call.function().arguments())
                    : call);
        }
        return normalized;
    }

    private Map<String, Object> parseArguments(String turnId, ToolCall call) {
        if (call.function() == null || !call.function().hasArguments()) return new LinkedHashMap<>();
        String raw = call.function().arguments();
        try {
            Map<String, Object> parsed = objectMapper.readValue(raw, ARGUMENTS_TYPE);
            return parsed == null ? new LinkedHashMap<>() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("[Agent:{}] Unparsable arguments for [{}], using none: {}", turnId, call.name(), raw);
            return new LinkedHashMap<>();
        }
    }

    private static void logDiscarded(String turnId, ToolInvocationResult result) {
        log.info("[Agent:{}] Client went away; discarding result of [{}] call={} error={}",
                turnId, result.name(), result.invocationId(), result.errorCode());
    }

    private String toJson(Map<String, Object> result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.error("[Agent] Tool result not serializable: {}", result, e);
            return "{\"error\":\"TOOL_FAILED\",\"message\":\"Result could not be encoded\"}";
        }
    }

    private static String errorMessage(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static String readPrompt(AgentProperties.Loop config) {
        try {
            return config.systemPrompt().getContentAsString(StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read system prompt from " + config.systemPrompt(), e);
        }
    }

    // ── Streaming listener ───────────────────────────────────────────────────

    private final class TurnListener implements CompletionListener {

        private final EventSink     sink;
        private final StringBuilder turnText;

        TurnListener(EventSink sink, StringBuilder turnText) {
            this.sink     = sink;
            this.turnText = turnText;
        }

        @Override
        public void onText(String text) {
            turnText.append(text);
            sink.emit(AgentEvent.textDelta(text));
        }

        @Override
        public void onToolArguments(int index, String callId, String fragment) {
            if (config.streamToolArguments()) {
                sink.emit(AgentEvent.toolArgsDelta(callId, fragment));
            }
        }
    }
}
