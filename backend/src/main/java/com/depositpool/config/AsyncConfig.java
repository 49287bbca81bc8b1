package com.depositpool.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named thread pools: monitor-executor runs per-deposit chain polls, pool-executor runs replenishment.
 * Pool allocation itself never runs here; it executes on the caller's thread.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String MONITOR_EXECUTOR = "monitor-executor";
    public static final String POOL_EXECUTOR = "pool-executor";

    /** Bounded poll concurrency; the queue absorbs a cycle's worth of deposits. */
    @Bean(name = MONITOR_EXECUTOR)
    public ThreadPoolTaskExecutor monitorExecutor(
            @Value("${depositpool.monitor.worker-threads}") int workerThreads) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(workerThreads);
        e.setMaxPoolSize(workerThreads);
        e.setQueueCapacity(10_000);
        e.setThreadNamePrefix("monitor-");
        e.initialize();
        return e;
    }

    /** Single thread: concurrent replenish runs would only overshoot the pool minimum. */
    @Bean(name = POOL_EXECUTOR)
    public ThreadPoolTaskExecutor poolExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setQueueCapacity(16);
        e.setThreadNamePrefix("pool-");
        e.initialize();
        return e;
    }
}
