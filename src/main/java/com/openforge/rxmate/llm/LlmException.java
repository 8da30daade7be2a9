package com.openforge.rxmate.llm;

/**
 * Completion-level failure. Not recoverable within a turn: the agent loop
 * reports it to the client and ends the turn.
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }

    /** HTTP 429 from the provider. */
    public static class RateLimited extends LlmException {
        public RateLimited(String message) {
            super(message);
        }
    }
}
