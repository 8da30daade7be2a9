package com.openforge.rxmate;

import com.openforge.rxmate.agent.AgentProperties;
import com.openforge.rxmate.llm.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({LlmProperties.class, AgentProperties.class})
public class RxmateApplication {

    public static void main(String[] args) {
        SpringApplication.run(RxmateApplication.class, args);
    }
}
