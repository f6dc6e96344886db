package com.liferx.brain.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Dedicated thread pool for streaming runs.
 *
 * Each assistant run holds one thread for its whole lifetime (model stream +
 * sequential tool calls) while the servlet thread returns immediately with
 * the SseEmitter. Kept apart from the web pool so long streams never starve
 * ordinary request handling. Queue capacity provides backpressure; when it
 * is full the submit is rejected and the request fails fast.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "streamTaskExecutor")
    public Executor streamTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("assistant-run-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
