package com.liferx.brain.config;

import com.liferx.brain.tool.ToolDefinition;
import com.liferx.brain.tool.ToolRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Every ToolDefinition bean is collected here and frozen into the registry.
 * Adding a tool means adding a @Component; there is no runtime registration.
 */
@Configuration
public class ToolRegistryConfig {

    @Bean
    public ToolRegistry toolRegistry(List<ToolDefinition<?>> tools) {
        return ToolRegistry.build(tools);
    }
}
