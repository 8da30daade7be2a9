package com.openforge.rxmate.config;

import com.openforge.rxmate.agent.AgentProperties;
import com.openforge.rxmate.llm.LlmProperties;
import com.openforge.rxmate.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;

/**
 * Logs what this instance is about to serve with: port, database reachability,
 * completion provider (key masked) and the agent loop limits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource      dataSource;
    private final LlmProperties   llmProperties;
    private final AgentProperties agentProperties;
    private final ToolRegistry    toolRegistry;
    private final Environment     env;

    @Override
    public void run(ApplicationArguments args) {
        AgentProperties.Loop loop = agentProperties.loop();

        log.info("RxMate ready on port {} (java {})",
                env.getProperty("server.port", "8080"), System.getProperty("java.version"));
        log.info("  database : {}", describeDatabase());
        log.info("  provider : {} model={} key={} endpoint={} timeout={}",
                llmProperties.name(), llmProperties.model(), maskKey(llmProperties.apiKey()),
                llmProperties.baseUrl(), llmProperties.timeout());
        log.info("  agent    : max-tool-rounds={} parallel={} tool-timeout={} tools={}",
                loop.maxToolRounds(), loop.parallelToolCalls(),
                agentProperties.tools().timeout(), toolRegistry.descriptors().size());
    }

    private String describeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData meta = conn.getMetaData();
            return meta.getDatabaseProductName() + " " + meta.getDatabaseProductVersion()
                    + " at " + meta.getURL().replaceAll("password=[^&;]*", "password=***");
        } catch (SQLException e) {
            log.warn("Database not reachable at startup: {}", e.getMessage());
            return "unreachable";
        }
    }

    /** First 6 and last 4 characters of the key; short keys are hidden entirely. */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) return "(not set)";
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
