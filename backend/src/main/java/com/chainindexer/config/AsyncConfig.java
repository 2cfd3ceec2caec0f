package com.chainindexer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. advisory-executor runs agent notifications off the sync thread; one thread keeps
 * notifications in chain order.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String ADVISORY_EXECUTOR = "advisory-executor";

    @Bean(name = ADVISORY_EXECUTOR)
    public Executor advisoryExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("advisory-");
        e.initialize();
        return e;
    }
}
