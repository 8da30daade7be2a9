package com.openforge.rxmate.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.openforge.rxmate.llm.model.ChatRequest;
import com.openforge.rxmate.llm.model.ChatResponse;
import com.openforge.rxmate.llm.model.Message;
import com.openforge.rxmate.llm.model.ToolCall;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmClientTest {

    private static final CompletionListener IGNORE_DELTAS = text -> { };

    private final ObjectMapper mapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private MockWebServer server;
    private LlmClient     client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        String baseUrl = server.url("/v1").toString().replaceAll("/$", "");
        LlmProperties properties = new LlmProperties("test", baseUrl,
                "sk-test", "test-model", Duration.ofSeconds(5), null);
        client = new LlmClient(HttpClient.newHttpClient(), mapper, properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    // ===== Stream assembly =====

    @Test
    void shouldForwardTextDeltasAndAssembleContent() {
        List<String> texts = new ArrayList<>();

        ChatResponse response = client.assembleStreamingResponse(Stream.of(
                "data: {\"id\":\"c1\",\"choices\":[{\"index\":0,\"delta\":{\"role\":\"assistant\"}}]}",
                "",
                "data: {\"id\":\"c1\",\"choices\":[{\"index\":0,\"delta\":{\"content\":\"We have \"}}]}",
                ": keep-alive",
                "data: {\"id\":\"c1\",\"choices\":[{\"index\":0,\"delta\":{\"content\":\"Tylenol.\"},\"finish_reason\":\"stop\"}]}",
                "data: [DONE]"), texts::add);

        assertThat(texts).containsExactly("We have ", "Tylenol.");
        Message message = response.firstMessage();
        assertThat(message.content()).isEqualTo("We have Tylenol.");
        assertThat(message.hasToolCalls()).isFalse();
        assertThat(response.choices().get(0).finishReason()).isEqualTo("stop");
    }

    @Test
    void shouldAssembleToolCallsFromFragmentsByIndex() {
        List<String> fragments = new ArrayList<>();
        CompletionListener listener = new CompletionListener() {
            @Override
            public void onText(String text) {
            }

            @Override
            public void onToolArguments(int index, String callId, String fragment) {
                fragments.add(index + ":" + callId + ":" + fragment);
            }
        };

        ChatResponse response = client.assembleStreamingResponse(Stream.of(
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_a\",\"type\":\"function\",\"function\":{\"name\":\"list_stores\",\"arguments\":\"\"}}]}}]}",
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"tool_calls\":[{\"index\":1,\"id\":\"call_b\",\"function\":{\"name\":\"get_medication_by_name\",\"arguments\":\"{\\\"name\\\":\"}}]}}]}",
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"{}\"}}]}}]}",
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"tool_calls\":[{\"index\":1,\"function\":{\"arguments\":\"\\\"Advil\\\"}\"}}]},\"finish_reason\":\"tool_calls\"}]}",
                "data: [DONE]"), listener);

        List<ToolCall> calls = response.firstMessage().toolCalls();
        assertThat(calls).extracting(ToolCall::id).containsExactly("call_a", "call_b");
        assertThat(calls).extracting(ToolCall::name).containsExactly("list_stores", "get_medication_by_name");
        assertThat(calls.get(1).function().arguments()).isEqualTo("{\"name\":\"Advil\"}");
        assertThat(response.firstMessage().content()).isNull();
        assertThat(fragments).containsExactly("1:call_b:{\"name\":", "0:call_a:{}", "1:call_b:\"Advil\"}");
    }

    @Test
    void shouldSkipUnparsableChunks() {
        ChatResponse response = client.assembleStreamingResponse(Stream.of(
                "data: {broken",
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"ok\"}}]}",
                "data: [DONE]"), IGNORE_DELTAS);

        assertThat(response.firstMessage().content()).isEqualTo("ok");
    }

    @Test
    void shouldFailWhenStreamEndsWithoutDone() {
        List<String> texts = new ArrayList<>();

        assertThatThrownBy(() -> client.assembleStreamingResponse(Stream.of(
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"Acamol is in st\"}}]}"), texts::add))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("[DONE]");
        assertThat(texts).containsExactly("Acamol is in st");
    }

    @Test
    void shouldRejectToolCallWithoutName() {
        assertThatThrownBy(() -> client.assembleStreamingResponse(Stream.of(
                "data: {\"choices\":[{\"index\":0,\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_a\",\"function\":{\"arguments\":\"{}\"}}]}}]}",
                "data: [DONE]"),
                IGNORE_DELTAS))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("without a name");
    }

    // ===== HTTP =====

    @Test
    void shouldPostStreamingRequestWithDefaults() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/event-stream")
                .setBody("data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"Hello\"}}]}\n\ndata: [DONE]\n\n"));

        ChatResponse response = client.complete(
                ChatRequest.withTools(List.of(Message.user("Hi")), List.of()), IGNORE_DELTAS);

        assertThat(response.firstMessage().content()).isEqualTo("Hello");
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        JsonNode sent = mapper.readTree(recorded.getBody().readUtf8());
        assertThat(sent.path("stream").asBoolean()).isTrue();
        assertThat(sent.path("model").asText()).isEqualTo("test-model");
        assertThat(sent.path("messages").get(0).path("role").asText()).isEqualTo("user");
        assertThat(sent.has("tools")).isFalse();
    }

    @Test
    void shouldFailOnHtmlBodyWithSuccessStatus() {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/html")
                .setBody("<html><body>Gateway login required</body></html>"));

        assertThatThrownBy(() -> client.complete(
                ChatRequest.withTools(List.of(Message.user("Hi")), List.of()), IGNORE_DELTAS))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("ended without [DONE]");
    }

    @Test
    void shouldFailOnJsonErrorObjectWithSuccessStatus() {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"error\":{\"message\":\"invalid model\"}}"));

        assertThatThrownBy(() -> client.complete(
                ChatRequest.withTools(List.of(Message.user("Hi")), List.of()), IGNORE_DELTAS))
                .isInstanceOf(LlmException.class);
    }

    @Test
    void shouldFailWhenConnectionDropsMidAnswer() {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/event-stream")
                .setBody("data: {\"choices\":[{\"index\":0,\"delta\":{\"content\":\"Acamol is in st\"}}]}\n\n"));

        assertThatThrownBy(() -> client.complete(
                ChatRequest.withTools(List.of(Message.user("Hi")), List.of()), IGNORE_DELTAS))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("ended without [DONE]");
    }

    @Test
    void shouldMapRateLimitResponse() {
        server.enqueue(new MockResponse().setResponseCode(429)
                .setBody("{\"error\":{\"message\":\"slow down\"}}"));

        assertThatThrownBy(() -> client.complete(
                ChatRequest.withTools(List.of(Message.user("Hi")), List.of()), IGNORE_DELTAS))
                .isInstanceOf(LlmException.RateLimited.class);
    }

    @Test
    void shouldIncludeProviderReasonForHttpErrors() {
        server.enqueue(new MockResponse().setResponseCode(500)
                .setBody("{\"error\":{\"message\":\"model overloaded\"}}"));

        assertThatThrownBy(() -> client.complete(
                ChatRequest.withTools(List.of(Message.user("Hi")), List.of()), IGNORE_DELTAS))
                .isInstanceOf(LlmException.class)
                .hasMessageContaining("HTTP 500")
                .hasMessageContaining("model overloaded");
    }
}
