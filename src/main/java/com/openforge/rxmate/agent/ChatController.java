package com.openforge.rxmate.agent;

import com.openforge.rxmate.agent.dto.ChatTurnRequest;
import com.openforge.rxmate.agent.dto.ChatTurnResponse;
import com.openforge.rxmate.agent.dto.ToolInfo;
import com.openforge.rxmate.agent.event.AgentEvent;
import com.openforge.rxmate.agent.event.CollectingEventSink;
import com.openforge.rxmate.stream.EmitterEventSink;
import com.openforge.rxmate.stream.SseEventEncoder;
import com.openforge.rxmate.tool.ToolRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Chat API.
 *
 * Endpoints:
 *   POST /api/chat/stream: run one turn, streaming events as text/event-stream
 *   POST /api/chat       : run one turn, answer with the collected events as JSON
 *   GET  /api/tools      : the tools the model may call
 *
 * Each streamed turn runs on {@code agentTurnExecutor}; the request thread
 * returns as soon as the emitter is handed to Spring MVC.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ChatController {

    private final AgentLoopService agentLoopService;
    private final ToolRegistry     toolRegistry;
    private final SseEventEncoder  encoder;
    private final AgentProperties  properties;
    private final ExecutorService  agentTurnExecutor;

    // ── Streaming turn ───────────────────────────────────────────────────────

    @PostMapping("/chat/stream")
    public ResponseEntity<ResponseBodyEmitter> stream(@Valid @RequestBody ChatTurnRequest request) {
        ResponseBodyEmitter emitter = new ResponseBodyEmitter(properties.loop().emitterTimeout().toMillis());
        EmitterEventSink sink = new EmitterEventSink(emitter, encoder);

        try {
            agentTurnExecutor.execute(() -> runStreamed(request, sink));
        } catch (RejectedExecutionException e) {
            log.warn("[Chat] Turn rejected, executor saturated: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Too many concurrent turns");
        }

        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache())
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }

    private void runStreamed(ChatTurnRequest request, EmitterEventSink sink) {
        try {
            agentLoopService.runTurn(request.messages(), sink);
        } catch (RuntimeException e) {
            // the loop reports completion failures itself; this is a bug path
            log.error("[Chat] Turn crashed: {}", e.getMessage(), e);
            sink.emit(AgentEvent.error("Internal error: " + e.getMessage()));
            sink.emit(AgentEvent.done());
        } finally {
            sink.complete();
        }
    }

    // ── Non-streaming turn ───────────────────────────────────────────────────

    @PostMapping("/chat")
    public ResponseEntity<ChatTurnResponse> chat(@Valid @RequestBody ChatTurnRequest request) {
        CollectingEventSink sink = new CollectingEventSink();
        TurnResult result = agentLoopService.runTurn(request.messages(), sink);
        return ResponseEntity.ok(ChatTurnResponse.of(result, sink.events()));
    }

    // ── Tool listing ─────────────────────────────────────────────────────────

    @GetMapping("/tools")
    public ResponseEntity<List<ToolInfo>> tools() {
        return ResponseEntity.ok(toolRegistry.descriptors().stream().map(ToolInfo::from).toList());
    }
}
