package com.openforge.rxmate.agent.event;

/**
 * Where the agent loop writes its events, one at a time and in order.
 *
 * A sink that can no longer deliver (client gone, write failed) reports
 * {@link #isOpen()} false and ignores further events.
 */
public interface EventSink {

    void emit(AgentEvent event);

    boolean isOpen();
}
