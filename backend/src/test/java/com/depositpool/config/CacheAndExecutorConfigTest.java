package com.depositpool.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class
}, properties = "depositpool.monitor.worker-threads=6")
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.MONITOR_EXECUTOR)
    ThreadPoolTaskExecutor monitorExecutor;

    @Autowired
    @Qualifier(AsyncConfig.POOL_EXECUTOR)
    ThreadPoolTaskExecutor poolExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Test
    @DisplayName("chain head and tx block caches are created and usable")
    void cachesCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.CHAIN_HEAD_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.TX_BLOCK_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.TX_BLOCK_CACHE).put("tx1", 1234L);
        assertThat(cacheManager.getCache(CaffeineConfig.TX_BLOCK_CACHE).get("tx1").get()).isEqualTo(1234L);
    }

    @Test
    @DisplayName("monitor executor follows worker-threads; pool executor is single-threaded")
    void executorsCreated() {
        assertThat(monitorExecutor.getCorePoolSize()).isEqualTo(6);
        assertThat(monitorExecutor.getMaxPoolSize()).isEqualTo(6);
        assertThat(monitorExecutor.getThreadNamePrefix()).isEqualTo("monitor-");
        assertThat(poolExecutor.getCorePoolSize()).isEqualTo(1);
        assertThat(poolExecutor.getMaxPoolSize()).isEqualTo(1);
    }

    @Test
    void schedulerPoolCreated() {
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(3);
    }
}
