package com.ai.booking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class ExecutorConfig {

    /** Spreadsheet writes and admin notifications. */
    @Bean(name = "mirrorExecutor")
    public Executor mirrorExecutor(
            @Value("${booking.mirror.write-threads:2}") int threads,
            @Value("${booking.mirror.write-queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int size = Math.max(1, threads);
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(Math.max(50, queueCapacity));
        executor.setThreadNamePrefix("mirror-");
        executor.initialize();
        return executor;
    }

    /** Turns received on channels that acknowledge before replying (Telegram, SMS). */
    @Bean(name = "turnExecutor")
    public Executor turnExecutor(
            @Value("${channels.processing-threads:4}") int threads,
            @Value("${channels.processing-queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int size = Math.max(1, threads);
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(Math.max(50, queueCapacity));
        executor.setThreadNamePrefix("turn-");
        executor.initialize();
        return executor;
    }
}
