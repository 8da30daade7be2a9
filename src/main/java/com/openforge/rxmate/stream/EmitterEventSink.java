package com.openforge.rxmate.stream;

import com.openforge.rxmate.agent.event.AgentEvent;
import com.openforge.rxmate.agent.event.EventSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Writes each event to the HTTP response as soon as it is produced.
 *
 * Frames are pre-encoded by {@link SseEventEncoder} and sent as plain UTF-8
 * text; the response itself is declared {@code text/event-stream} by the
 * controller. The sink closes when the client disconnects, the emitter times
 * out, or a write fails; later events are dropped.
 */
@Slf4j
public class EmitterEventSink implements EventSink {

    private static final MediaType FRAME_TYPE = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final ResponseBodyEmitter emitter;
    private final SseEventEncoder     encoder;
    private final AtomicBoolean       open = new AtomicBoolean(true);

    public EmitterEventSink(ResponseBodyEmitter emitter, SseEventEncoder encoder) {
        this.emitter = emitter;
        this.encoder = encoder;
        emitter.onCompletion(() -> open.set(false));
        emitter.onTimeout(() -> {
            log.info("[Stream] Emitter timed out; closing sink");
            open.set(false);
        });
        emitter.onError(e -> {
            log.info("[Stream] Client connection failed: {}", e.getMessage());
            open.set(false);
        });
    }

    @Override
    public synchronized void emit(AgentEvent event) {
        if (!open.get()) {
            log.debug("[Stream] Sink closed; dropping {} event", event.type());
            return;
        }
        try {
            emitter.send(encoder.encode(event), FRAME_TYPE);
        } catch (IOException | IllegalStateException e) {
            log.info("[Stream] Write of {} event failed, client likely gone: {}", event.type(), e.getMessage());
            open.set(false);
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    /** Ends the response; a no-op once the sink is already closed. */
    public synchronized void complete() {
        if (open.getAndSet(false)) {
            emitter.complete();
        }
    }
}
