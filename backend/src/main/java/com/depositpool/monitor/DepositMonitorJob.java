package com.depositpool.monitor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs one monitor cycle per poll interval. Fixed delay, so cycles never overlap on one instance.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DepositMonitorJob {

    private final DepositMonitor depositMonitor;

    @Scheduled(fixedDelayString = "${depositpool.monitor.poll-interval}")
    public void tick() {
        try {
            depositMonitor.runCycle();
        } catch (Exception e) {
            log.error("Monitor cycle failed: {}", e.getMessage(), e);
        }
    }
}
