package com.openforge.rxmate.llm;

import com.openforge.rxmate.llm.model.ChatRequest;
import com.openforge.rxmate.llm.model.ChatResponse;

/**
 * The single pluggable completion capability the agent loop talks to.
 *
 * Given a message history and tool schema, returns the assembled assistant
 * message: text, requested tool calls, or both. Text is also streamed to the
 * listener as it arrives. Any failure (network, provider, timeout, malformed
 * response) is thrown as an {@link LlmException}.
 */
public interface CompletionClient {

    ChatResponse complete(ChatRequest request, CompletionListener listener);
}
