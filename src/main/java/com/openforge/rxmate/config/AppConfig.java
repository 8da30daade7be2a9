package com.openforge.rxmate.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Shared infrastructure. Each kind of blocking work gets its own named pool,
 * injected by parameter name:
 * <ul>
 *   <li>{@code agentTurnExecutor} drives a streamed turn for its whole lifetime</li>
 *   <li>{@code llmCallExecutor} and {@code toolExecutor} run work under a time limiter</li>
 *   <li>{@code toolBatchExecutor} fans out a round's calls in parallel mode</li>
 *   <li>{@code toolStatsExecutor} is the single writer of usage counters</li>
 * </ul>
 */
@Configuration
public class AppConfig {

    @Bean
    public ExecutorService agentTurnExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("agent-turn-"));
    }

    @Bean
    public ExecutorService llmCallExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("llm-call-"));
    }

    @Bean
    public ExecutorService toolExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("tool-"));
    }

    @Bean
    public ExecutorService toolBatchExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("tool-batch-"));
    }

    @Bean
    public ExecutorService toolStatsExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("tool-stats-"));
    }

    /** Connect timeout only; the whole-call bound is agent.llm.timeout, applied per request. */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /** snake_case on the wire for both the chat API and the provider; unknown provider fields are ignored. */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /** Prescriptions expire by calendar date in UTC. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
