package com.liferx.brain;

import com.liferx.brain.config.AgentProperties;
import com.liferx.brain.llm.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AgentProperties.class, LlmProperties.class})
public class BrainAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(BrainAgentApplication.class, args);
    }
}
