package com.depositpool.pool;

import com.depositpool.config.AsyncConfig;
import com.depositpool.domain.PoolExhaustedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps the pool at its minimum size: on start-up, on every replenish interval, and immediately (off the
 * caller's thread) when an allocation finds the pool empty.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PoolReplenishJob {

    private final PoolManager poolManager;

    @EventListener(ApplicationReadyEvent.class)
    @Async(AsyncConfig.POOL_EXECUTOR)
    public void onApplicationReady() {
        poolManager.replenish();
    }

    @Scheduled(fixedDelayString = "${depositpool.pool.replenish-interval}")
    public void tick() {
        poolManager.replenish();
    }

    @EventListener
    @Async(AsyncConfig.POOL_EXECUTOR)
    public void onPoolExhausted(PoolExhaustedEvent event) {
        log.info("Replenishing after pool exhaustion (deposit {})", event.depositId());
        poolManager.replenish();
    }
}
