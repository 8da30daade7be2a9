package com.openforge.rxmate.llm;

import com.openforge.rxmate.llm.model.ChatResponse;
import com.openforge.rxmate.llm.model.FunctionCallResult;
import com.openforge.rxmate.llm.model.Message;
import com.openforge.rxmate.llm.model.StreamingChunk;
import com.openforge.rxmate.llm.model.ToolCall;

import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Folds the chunks of one streamed completion into a single assistant reply,
 * forwarding text and argument fragments to the listener on the way.
 * Tool calls are ordered by the index the provider assigns them. Not thread-safe;
 * one instance per completion.
 */
final class StreamedReplyAssembler {

    private final String             provider;
    private final CompletionListener listener;

    private final StringBuilder text = new StringBuilder();
    private final SortedMap<Integer, PendingCall> calls = new TreeMap<>();

    private String id;
    private String model;
    private String finishReason;

    StreamedReplyAssembler(String provider, CompletionListener listener) {
        this.provider = provider;
        this.listener = listener;
    }

    void accept(StreamingChunk chunk) {
        if (id == null) id = chunk.id();
        if (model == null) model = chunk.model();

        StreamingChunk.ChunkChoice choice = chunk.firstChoice();
        if (choice == null) return;
        if (choice.finishReason() != null) finishReason = choice.finishReason();
        if (choice.delta() == null) return;

        String content = choice.delta().content();
        if (content != null && !content.isEmpty()) {
            text.append(content);
            listener.onText(content);
        }
        List<StreamingChunk.ToolCallDelta> fragments = choice.delta().toolCalls();
        if (fragments != null) {
            fragments.forEach(this::acceptToolFragment);
        }
    }

    private void acceptToolFragment(StreamingChunk.ToolCallDelta fragment) {
        int index = fragment.index() == null ? 0 : fragment.index();
        PendingCall call = calls.computeIfAbsent(index, i -> new PendingCall());
        if (fragment.id() != null) call.id = fragment.id();
        if (fragment.type() != null) call.type = fragment.type();

        StreamingChunk.FunctionDelta function = fragment.function();
        if (function == null) return;
        if (function.name() != null) call.name = function.name();
        if (function.arguments() != null && !function.arguments().isEmpty()) {
            call.arguments.append(function.arguments());
            listener.onToolArguments(index, call.id, function.arguments());
        }
    }

    /**
     * @throws LlmException if a streamed tool call never received a function name
     */
    ChatResponse toResponse() {
        List<ToolCall> toolCalls = calls.isEmpty() ? null : calls.values().stream()
                .map(this::complete)
                .toList();
        Message reply = Message.assistantToolCalls(text.isEmpty() ? null : text.toString(), toolCalls);
        return ChatResponse.assembled(id, model, reply, finishReason);
    }

    int textLength() {
        return text.length();
    }

    int toolCallCount() {
        return calls.size();
    }

    String finishReason() {
        return finishReason;
    }

    private ToolCall complete(PendingCall call) {
        if (call.name == null || call.name.isEmpty()) {
            throw new LlmException("Provider [%s] streamed a tool call without a name".formatted(provider));
        }
        return new ToolCall(call.id, call.type, new FunctionCallResult(call.name, call.arguments.toString()));
    }

    private static final class PendingCall {
        private String id = "";
        private String type = "function";
        private String name;
        private final StringBuilder arguments = new StringBuilder();
    }
}
