package com.liferx.brain.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the OpenAI-compatible chat completions backend.
 */
@ConfigurationProperties(prefix = "openai")
@Data
public class LlmProperties {
    private String apiKey;
    private String baseUrl = "https://api.openai.com/v1";
    private String model = "gpt-4o";
    private int maxTokens = 2048;
    private double temperature = 0.3;
    private int connectTimeoutMs = 5000;

    /** Max silence between streamed bytes before the call is abandoned */
    private int readTimeoutMs = 60000;
}
