package com.openforge.rxmate.agent.event;

import java.util.ArrayList;
import java.util.List;

/** Keeps every event in memory; backs the non-streaming chat endpoint. */
public class CollectingEventSink implements EventSink {

    private final List<AgentEvent> events = new ArrayList<>();

    @Override
    public synchronized void emit(AgentEvent event) {
        events.add(event);
    }

    @Override
    public boolean isOpen() {
        return true;
    }

    public synchronized List<AgentEvent> events() {
        return List.copyOf(events);
    }
}
