package com.chainwatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools. The ingestion executor hosts one long-running watcher per enabled chain.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String INGESTION_EXECUTOR = "ingestion-executor";

    /** One thread per supported network; watchers never share a thread. */
    @Bean(name = INGESTION_EXECUTOR)
    public ThreadPoolTaskExecutor ingestionExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(8);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("ingest-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }
}
