package com.openforge.rxmate.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.rxmate.llm.model.ChatRequest;
import com.openforge.rxmate.llm.model.ChatResponse;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * The completion client the agent loop actually uses.
 *
 * Call graph:
 *
 *   complete(request, listener)
 *     └─ circuitBreaker
 *           └─ timeLimiter (agent.llm.timeout)
 *                 └─ llmCallExecutor → delegate.complete(request, gatedListener)
 *
 * The listener is gated: once the call has returned, failed or timed out,
 * late fragments from the still-draining provider stream are dropped, so a
 * timed-out completion never leaks text after the turn reported the error.
 *
 * No retry is attempted; a failed completion ends the turn.
 */
@Slf4j
@Component
public class GuardedCompletionClient implements CompletionClient {

    private final CompletionClient delegate;
    private final String           providerName;
    private final CircuitBreaker   circuitBreaker;
    private final TimeLimiter      timeLimiter;
    private final ExecutorService  llmCallExecutor;

    @Autowired
    public GuardedCompletionClient(HttpClient httpClient,
                                   ObjectMapper objectMapper,
                                   LlmProperties properties,
                                   CircuitBreaker completionCircuitBreaker,
                                   TimeLimiter completionTimeLimiter,
                                   ExecutorService llmCallExecutor) {
        this(new LlmClient(httpClient, objectMapper, properties), properties.name(),
                completionCircuitBreaker, completionTimeLimiter, llmCallExecutor);
    }

    public GuardedCompletionClient(CompletionClient delegate,
                                   String providerName,
                                   CircuitBreaker circuitBreaker,
                                   TimeLimiter timeLimiter,
                                   ExecutorService llmCallExecutor) {
        this.delegate        = delegate;
        this.providerName    = providerName;
        this.circuitBreaker  = circuitBreaker;
        this.timeLimiter     = timeLimiter;
        this.llmCallExecutor = llmCallExecutor;
    }

    @Override
    public ChatResponse complete(ChatRequest request, CompletionListener listener) {
        GatedListener gate = new GatedListener(listener);

        Callable<ChatResponse> timed = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> llmCallExecutor.submit(() -> delegate.complete(request, gate)));
        Callable<ChatResponse> guarded = CircuitBreaker.decorateCallable(circuitBreaker, timed);

        try {
            return guarded.call();
        } catch (TimeoutException e) {
            log.warn("[Completion:{}] Timed out after {}", providerName,
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new LlmTimeoutException(providerName,
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
        } catch (CallNotPermittedException e) {
            log.warn("[Completion:{}] Circuit breaker is {}; failing fast",
                    providerName, circuitBreaker.getState());
            throw new LlmException("Provider [%s] is temporarily unavailable".formatted(providerName), e);
        } catch (LlmException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Interrupted while waiting for provider [%s]".formatted(providerName), e);
        } catch (Exception e) {
            throw new LlmException("Completion from provider [%s] failed: %s"
                    .formatted(providerName, e.getMessage()), e);
        } finally {
            gate.close();
        }
    }

    // ── Listener gate ────────────────────────────────────────────────────────

    private static final class GatedListener implements CompletionListener {

        private final CompletionListener target;
        private boolean open = true;

        GatedListener(CompletionListener target) {
            this.target = target;
        }

        @Override
        public synchronized void onText(String text) {
            if (open) target.onText(text);
        }

        @Override
        public synchronized void onToolArguments(int index, String callId, String fragment) {
            if (open) target.onToolArguments(index, callId, fragment);
        }

        synchronized void close() {
            open = false;
        }
    }
}
