package com.openforge.rxmate.agent;

/**
 * States of one user turn.
 *
 *   AWAITING_COMPLETION → STREAMING_TEXT      → TERMINATED
 *                       → HANDLING_TOOL_CALLS → AWAITING_COMPLETION | TERMINATED
 *                       → ABORTED
 *
 * Any non-terminal state may end in CANCELLED when the client goes away.
 */
public enum TurnState {
    AWAITING_COMPLETION,
    STREAMING_TEXT,
    HANDLING_TOOL_CALLS,
    TERMINATED,
    ABORTED,
    CANCELLED;

    public boolean isFinal() {
        return this == TERMINATED || this == ABORTED || this == CANCELLED;
    }
}
