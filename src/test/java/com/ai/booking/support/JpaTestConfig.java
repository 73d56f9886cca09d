package com.ai.booking.support;

import com.ai.booking.config.BookingProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.core.task.SyncTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Runs mirror writes and notifications on the calling thread so tests can
 * assert on their outcome right after the call.
 */
@TestConfiguration
@EnableConfigurationProperties(BookingProperties.class)
public class JpaTestConfig {

    @Bean(name = "mirrorExecutor")
    public Executor mirrorExecutor() {
        return new SyncTaskExecutor();
    }
}
