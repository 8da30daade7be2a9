package com.openforge.rxmate.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.core.io.Resource;

import java.time.Duration;

/**
 * Agent loop and tool dispatch settings, under the "agent" prefix:
 *
 * agent:
 *   loop:
 *     max-tool-rounds: ${MAX_TOOL_ROUNDS:10}
 *     parallel-tool-calls: false
 *     stream-tool-arguments: false
 *     system-prompt: classpath:prompts/system-prompt.txt
 *     emitter-timeout: 5m
 *   tools:
 *     timeout: 15s
 *     schemas: classpath:tools/pharmacy-tools.json
 */
@ConfigurationProperties(prefix = "agent")
public record AgentProperties(
        @DefaultValue Loop loop,
        @DefaultValue Tools tools
) {

    public record Loop(
            @DefaultValue("10") int maxToolRounds,
            @DefaultValue("false") boolean parallelToolCalls,
            @DefaultValue("false") boolean streamToolArguments,
            @DefaultValue("classpath:prompts/system-prompt.txt") Resource systemPrompt,
            @DefaultValue("5m") Duration emitterTimeout
    ) {
        public Loop {
            if (maxToolRounds < 1) {
                throw new IllegalArgumentException("agent.loop.max-tool-rounds must be positive, got " + maxToolRounds);
            }
        }
    }

    public record Tools(
            @DefaultValue("15s") Duration timeout,
            @DefaultValue("classpath:tools/pharmacy-tools.json") Resource schemas
    ) {}
}
