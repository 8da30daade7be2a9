package com.openforge.rxmate.config;

import com.openforge.rxmate.agent.AgentProperties;
import com.openforge.rxmate.llm.LlmProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Resilience4j instances guarding the two blocking edges of a turn: the
 * completion call (breaker plus time limit) and each tool handler (time limit).
 * Failed completions are not retried; the turn ends and the client may resend.
 */
@Configuration
public class Resilience4jConfig {

    static final String COMPLETION = "completion";
    static final String TOOL       = "tool";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(LlmProperties llmProperties) {
        // a call running into the time limit counts as slow as well as failed
        CircuitBreakerConfig completionDefaults = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                .slowCallDurationThreshold(llmProperties.timeout())
                .slowCallRateThreshold(100)
                .waitDurationInOpenState(Duration.ofSeconds(20))
                .permittedNumberOfCallsInHalfOpenState(1)
                .recordExceptions(IOException.class, TimeoutException.class, RuntimeException.class)
                .build();
        return CircuitBreakerRegistry.of(completionDefaults);
    }

    @Bean
    public CircuitBreaker completionCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(COMPLETION);
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        return TimeLimiterRegistry.ofDefaults();
    }

    /** Interrupts the provider call on timeout so its thread is released. */
    @Bean
    public TimeLimiter completionTimeLimiter(TimeLimiterRegistry registry, LlmProperties llmProperties) {
        return registry.timeLimiter(COMPLETION, TimeLimiterConfig.custom()
                .timeoutDuration(llmProperties.timeout())
                .cancelRunningFuture(true)
                .build());
    }

    /** Lets a timed-out handler finish its own transaction; only the caller stops waiting. */
    @Bean
    public TimeLimiter toolTimeLimiter(TimeLimiterRegistry registry, AgentProperties agentProperties) {
        return registry.timeLimiter(TOOL, TimeLimiterConfig.custom()
                .timeoutDuration(agentProperties.tools().timeout())
                .cancelRunningFuture(false)
                .build());
    }
}
