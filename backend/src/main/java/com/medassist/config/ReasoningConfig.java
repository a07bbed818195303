package com.medassist.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableAsync
@EnableScheduling
public class ReasoningConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Executor for the per-pass fan-out over fact and evidence sources.
     */
    @Bean
    public ThreadPoolTaskExecutor sourceFetchExecutor(ReasoningProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getSources().getPoolSize());
        executor.setMaxPoolSize(properties.getSources().getPoolSize());
        executor.setQueueCapacity(256);
        executor.setThreadNamePrefix("source-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Executor behind {@code @Async}, used for audit writes.
     */
    @Bean(name = "taskExecutor")
    public ThreadPoolTaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("audit-");
        executor.initialize();
        return executor;
    }
}
