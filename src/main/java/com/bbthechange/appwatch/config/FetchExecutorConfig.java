package com.bbthechange.appwatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded worker pool used to fetch tracked apps in parallel within a cycle.
 */
@Configuration
public class FetchExecutorConfig {

    @Bean(name = "catalogFetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService catalogFetchExecutor(MonitorProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "catalog-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getFetchParallelism()), threadFactory);
    }
}
