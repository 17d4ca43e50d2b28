package com.reportalert.engine.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Pool for render and deliver calls, kept apart from the scheduler's workers so a
 * stuck collaborator can be timed out and interrupted without blocking the tick.
 */
@Configuration
public class AsyncConfig {

    @Bean
    public ThreadPoolTaskExecutor collaboratorExecutor(EngineProperties properties) {
        var poolSize = properties.delivery().collaboratorPoolSize();
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("collaborator-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
