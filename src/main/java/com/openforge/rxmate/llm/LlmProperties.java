package com.openforge.rxmate.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Externalised completion provider configuration.
 *
 * Reads from application.yml under the "agent.llm" prefix:
 *
 * agent:
 *   llm:
 *     name: openai
 *     base-url: https://api.openai.com/v1
 *     api-key: ${MODEL_API_KEY}
 *     model: gpt-4o-mini
 *     timeout: 120s
 *
 * timeout bounds one whole completion call, stream included.
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        @DefaultValue("openai") String name,
        @DefaultValue("https://api.openai.com/v1") String baseUrl,
        String apiKey,
        @DefaultValue("gpt-4o-mini") String model,
        @DefaultValue("120s") Duration timeout,
        Double temperature
) {}
