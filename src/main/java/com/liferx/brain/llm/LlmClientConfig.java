package com.liferx.brain.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw streaming client. {@link ResilientModelBackend} wraps it
 * and is what the orchestrator receives.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class LlmClientConfig {

    private final LlmProperties props;

    @PostConstruct
    public void logActiveModel() {
        log.info("================================================================");
        log.info("  Model backend : {}", props.getBaseUrl());
        log.info("  Model         : {}", props.getModel());
        logKey(props.getApiKey());
        log.info("================================================================");
    }

    @Bean("openAiStreamingClient")
    public ModelBackend openAiStreamingClient(
            ObjectMapper objectMapper,
            @Qualifier("modelRestClientBuilder") RestClient.Builder builder) {
        return new OpenAiStreamingClient(props, objectMapper, builder.clone());
    }

    private void logKey(String key) {
        if (key == null || key.isBlank()) {
            log.error("  API key not set! Set env var: OPENAI_API_KEY={your-key}");
        } else {
            log.info("  Key           : {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
