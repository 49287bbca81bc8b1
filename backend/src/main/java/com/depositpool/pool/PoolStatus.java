package com.depositpool.pool;

/**
 * Snapshot of address counts per status. Counts come from separate queries, so they may be slightly skewed
 * while allocations are in flight.
 *
 * @param utilizationPercent share of held addresses (assigned + monitoring + cooldown), one decimal
 */
public record PoolStatus(
        long total,
        long available,
        long assigned,
        long monitoring,
        long cooldown,
        double utilizationPercent,
        PoolHealth health) {
}
