package com.openforge.rxmate.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.rxmate.agent.event.AgentEvent;
import com.openforge.rxmate.agent.event.EventSink;
import com.openforge.rxmate.agent.event.EventType;
import com.openforge.rxmate.config.AppConfig;
import com.openforge.rxmate.llm.model.Message;
import com.openforge.rxmate.stream.SseEventEncoder;
import com.openforge.rxmate.tool.ToolDescriptor;
import com.openforge.rxmate.tool.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatController.class)
@Import({AppConfig.class, SseEventEncoder.class})
class ChatControllerWebTest {

    private static final String ONE_USER_MESSAGE = """
            {"messages": [{"role": "user", "content": "Do you have Advil?"}]}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SseEventEncoder encoder;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AgentLoopService agentLoopService;

    @MockBean
    private ToolRegistry toolRegistry;

    @Test
    void streamsEveryEventAsServerSentEventFrame() throws Exception {
        when(agentLoopService.runTurn(anyList(), any())).thenAnswer(invocation -> {
            EventSink sink = invocation.getArgument(1);
            sink.emit(AgentEvent.toolCall("list_stores", "call_1", Map.of()));
            sink.emit(AgentEvent.toolResult("list_stores", "call_1", Map.of("count", 3)));
            sink.emit(AgentEvent.textDelta("We have "));
            sink.emit(AgentEvent.textDelta("3 stores."));
            sink.emit(AgentEvent.done());
            return new TurnResult(TurnState.TERMINATED, Message.assistantText("We have 3 stores."), List.of(), 1);
        });

        MvcResult result = mockMvc.perform(post("/api/chat/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ONE_USER_MESSAGE))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(5_000);

        assertThat(result.getResponse().getContentType()).startsWith("text/event-stream");
        assertThat(result.getResponse().getHeader("Cache-Control")).isEqualTo("no-cache");
        assertThat(result.getResponse().getHeader("X-Accel-Buffering")).isEqualTo("no");
        List<AgentEvent> events = encoder.decodeAll(result.getResponse().getContentAsString());
        assertThat(events).extracting(AgentEvent::type).containsExactly(
                EventType.TOOL_CALL, EventType.TOOL_RESULT, EventType.TEXT_DELTA, EventType.TEXT_DELTA, EventType.DONE);
        assertThat(events.get(1).result()).containsEntry("count", 3);
    }

    @Test
    void streamsErrorAndDoneWhenTurnCrashes() throws Exception {
        when(agentLoopService.runTurn(anyList(), any())).thenThrow(new IllegalStateException("boom"));

        MvcResult result = mockMvc.perform(post("/api/chat/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ONE_USER_MESSAGE))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(5_000);

        List<AgentEvent> events = encoder.decodeAll(result.getResponse().getContentAsString());
        assertThat(events).extracting(AgentEvent::type).containsExactly(EventType.ERROR, EventType.DONE);
        assertThat(events.get(0).error().message()).contains("boom");
    }

    @Test
    void answersNonStreamingTurnWithCollectedEvents() throws Exception {
        when(agentLoopService.runTurn(anyList(), any())).thenAnswer(invocation -> {
            List<Message> history = invocation.getArgument(0);
            EventSink sink = invocation.getArgument(1);
            sink.emit(AgentEvent.textDelta("Yes."));
            sink.emit(AgentEvent.done());
            List<Message> extended = new java.util.ArrayList<>(history);
            extended.add(Message.assistantText("Yes."));
            return new TurnResult(TurnState.TERMINATED, Message.assistantText("Yes."), extended, 0);
        });

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ONE_USER_MESSAGE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message.role").value("assistant"))
                .andExpect(jsonPath("$.message.content").value("Yes."))
                .andExpect(jsonPath("$.messages.length()").value(2))
                .andExpect(jsonPath("$.events[0].type").value("text_delta"))
                .andExpect(jsonPath("$.events[1].type").value("done"))
                .andExpect(jsonPath("$.state").value("TERMINATED"));
    }

    @Test
    void passesToolMessagesThroughInSnakeCase() throws Exception {
        when(agentLoopService.runTurn(anyList(), any())).thenAnswer(invocation ->
                new TurnResult(TurnState.TERMINATED, Message.assistantText(""), invocation.getArgument(0), 0));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"messages": [
                                  {"role": "user", "content": "Stores?"},
                                  {"role": "assistant", "tool_calls": [
                                    {"id": "call_1", "type": "function",
                                     "function": {"name": "list_stores", "arguments": "{}"}}]},
                                  {"role": "tool", "tool_call_id": "call_1", "content": "{\\"count\\":3}"}
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages[1].tool_calls[0].function.name").value("list_stores"))
                .andExpect(jsonPath("$.messages[2].tool_call_id").value("call_1"));
    }

    @Test
    void rejectsEmptyHistory() throws Exception {
        mockMvc.perform(post("/api/chat/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messages\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("messages")));

        verify(agentLoopService, never()).runTurn(anyList(), any());
    }

    @Test
    void rejectsMessageWithoutRole() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messages\": [{\"content\": \"hi\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("role")));
    }

    @Test
    void rejectsMalformedBody() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messages\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @Test
    void listsRegisteredToolsWithoutHandlers() throws Exception {
        when(toolRegistry.descriptors()).thenReturn(List.of(new ToolDescriptor(
                "check_stock_availability", "Stock of one medication in one store",
                objectMapper.readTree("{\"type\":\"object\"}"), List.of("med_id", "store_id"), args -> Map.of())));

        mockMvc.perform(get("/api/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("check_stock_availability"))
                .andExpect(jsonPath("$[0].parameters.type").value("object"))
                .andExpect(jsonPath("$[0].required[1]").value("store_id"))
                .andExpect(jsonPath("$[0].handler").doesNotExist());
    }
}
