package com.openforge.rxmate.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.rxmate.agent.event.AgentEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Frames stream events for the wire and back.
 *
 * One event per frame:
 *
 *   data: {"type":"text_delta","delta":"Hel"}\n
 *   \n
 *
 * The JSON never contains a raw newline, so a frame is always one marked
 * line followed by a blank line. Stateless; encoding never merges or drops.
 */
@Component
@RequiredArgsConstructor
public class SseEventEncoder {

    static final String DATA_PREFIX = "data:";
    static final String DELIMITER   = "\n\n";

    private final ObjectMapper objectMapper;

    public String encode(AgentEvent event) {
        try {
            return DATA_PREFIX + " " + objectMapper.writeValueAsString(event) + DELIMITER;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + event.type() + " event", e);
        }
    }

    /** Parses a single frame; surrounding whitespace and non-data lines are ignored. */
    public AgentEvent decode(String frame) {
        for (String line : frame.split("\n")) {
            String trimmed = line.strip();
            if (!trimmed.startsWith(DATA_PREFIX)) continue;
            String json = trimmed.substring(DATA_PREFIX.length()).strip();
            try {
                return objectMapper.readValue(json, AgentEvent.class);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Malformed event payload: " + json, e);
            }
        }
        throw new IllegalArgumentException("Frame has no data line: " + frame);
    }

    /** Splits a whole stream on the blank-line delimiter and decodes every frame, in order. */
    public List<AgentEvent> decodeAll(String stream) {
        List<AgentEvent> events = new ArrayList<>();
        for (String frame : stream.replace("\r\n", "\n").split(DELIMITER)) {
            if (!frame.isBlank()) events.add(decode(frame));
        }
        return events;
    }
}
