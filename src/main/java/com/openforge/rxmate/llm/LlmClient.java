package com.openforge.rxmate.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.rxmate.llm.model.ChatRequest;
import com.openforge.rxmate.llm.model.ChatResponse;
import com.openforge.rxmate.llm.model.StreamingChunk;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Iterator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Blocking client for an OpenAI-compatible {@code /chat/completions} endpoint.
 * Every call is made with {@code "stream": true}; deltas reach the
 * {@link CompletionListener} while they arrive and the assembled reply is
 * returned once the provider sends {@code [DONE]}. Timeouts and the circuit
 * breaker live in {@link GuardedCompletionClient}.
 */
@Slf4j
public class LlmClient implements CompletionClient {

    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE        = "[DONE]";
    private static final int    ERROR_SNIPPET_CHARS = 2048;

    private final HttpClient    httpClient;
    private final ObjectMapper  objectMapper;
    private final LlmProperties config;

    public LlmClient(HttpClient httpClient, ObjectMapper objectMapper, LlmProperties config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    @Override
    public ChatResponse complete(ChatRequest request, CompletionListener listener) {
        if (request == null) {
            throw new LlmException("No request given for provider [%s]".formatted(config.name()));
        }
        ChatRequest resolved = withProviderDefaults(request);
        String body = streamingBody(resolved);
        log.debug("[LlmClient:{}] POST /chat/completions model={} messages={} bytes={}",
                config.name(), resolved.model(), resolved.messages().size(), body.length());

        HttpResponse<Stream<String>> response = send(body);
        try (Stream<String> lines = response.body()) {
            failOnErrorStatus(response.statusCode(), lines);
            return assembleStreamingResponse(lines, listener);
        } catch (UncheckedIOException e) {
            throw new LlmException("Stream from provider [%s] broke off: %s"
                    .formatted(config.name(), e.getMessage()), e);
        }
    }

    private ChatRequest withProviderDefaults(ChatRequest request) {
        boolean modelGiven = request.model() != null && !request.model().isBlank();
        return request.toBuilder()
                .model(modelGiven ? request.model() : config.model())
                .temperature(request.temperature() == null ? config.temperature() : request.temperature())
                .build();
    }

    private HttpResponse<Stream<String>> send(String body) {
        try {
            return httpClient.send(buildHttpRequest(body), HttpResponse.BodyHandlers.ofLines());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while calling provider [%s]".formatted(config.name()), e);
        } catch (IOException e) {
            throw new LlmException("Network error calling provider [%s]: %s"
                    .formatted(config.name(), e.getMessage()), e);
        }
    }

    /** Error bodies carry the provider's reason; only a bounded prefix is kept. */
    private void failOnErrorStatus(int status, Stream<String> lines) {
        if (status == 429) {
            throw new LlmException.RateLimited("Rate-limited by provider [%s]".formatted(config.name()));
        }
        if (status / 100 != 2) {
            String reason = lines.limit(20).collect(Collectors.joining("\n"));
            if (reason.length() > ERROR_SNIPPET_CHARS) reason = reason.substring(0, ERROR_SNIPPET_CHARS);
            throw new LlmException("Provider [%s] returned HTTP %d: %s".formatted(config.name(), status, reason));
        }
    }

    /**
     * Consumes {@code data:} lines up to {@code [DONE]}; comments, blank lines
     * and chunks that fail to parse are skipped.
     *
     * @throws LlmException if the body ends before {@code [DONE]}, which covers
     *                      non-SSE bodies and connections dropped mid-answer
     */
    ChatResponse assembleStreamingResponse(Stream<String> lines, CompletionListener listener) {
        StreamedReplyAssembler assembler = new StreamedReplyAssembler(config.name(), listener);
        boolean terminated = false;
        Iterator<String> it = lines.iterator();
        while (it.hasNext()) {
            String line = it.next();
            if (!line.startsWith(SSE_DATA_PREFIX)) continue;

            String payload = line.substring(SSE_DATA_PREFIX.length()).trim();
            if (SSE_DONE.equals(payload)) {
                terminated = true;
                break;
            }
            if (payload.isEmpty()) continue;

            try {
                assembler.accept(objectMapper.readValue(payload, StreamingChunk.class));
            } catch (JsonProcessingException e) {
                log.warn("[LlmClient:{}] Skipping unparsable SSE chunk: {}", config.name(), payload);
            }
        }

        if (!terminated) {
            throw new LlmException("Stream from provider [%s] ended without [DONE] after %d text chars and %d tool calls"
                    .formatted(config.name(), assembler.textLength(), assembler.toolCallCount()));
        }

        ChatResponse response = assembler.toResponse();
        log.debug("[LlmClient:{}] stream finished id={} finish_reason={} text-length={} tool_calls={}",
                config.name(), response.id(), assembler.finishReason(),
                assembler.textLength(), assembler.toolCallCount());
        return response;
    }

    private HttpRequest buildHttpRequest(String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.baseUrl() + "/chat/completions"))
                .timeout(config.timeout())
                .header("Content-Type", "application/json")
                .header("Accept", "text/event-stream")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (config.apiKey() != null && !config.apiKey().isBlank()) {
            builder.header("Authorization", "Bearer " + config.apiKey());
        }
        return builder.build();
    }

    private String streamingBody(ChatRequest request) {
        try {
            ObjectNode json = objectMapper.valueToTree(request);
            json.put("stream", true);
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new LlmException("Could not encode request for provider [%s]".formatted(config.name()), e);
        }
    }
}
