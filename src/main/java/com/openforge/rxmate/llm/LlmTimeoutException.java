package com.openforge.rxmate.llm;

import java.time.Duration;

/** The completion call did not finish within {@code agent.llm.timeout}. */
public class LlmTimeoutException extends LlmException {

    public LlmTimeoutException(String provider, Duration timeout) {
        super("Provider [%s] did not complete within %d ms".formatted(provider, timeout.toMillis()));
    }
}
