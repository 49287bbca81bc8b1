package com.depositpool.domain;

/**
 * Application event: an allocation found no AVAILABLE address. Consumed by PoolReplenishJob.
 */
public record PoolExhaustedEvent(String depositId) {
}
