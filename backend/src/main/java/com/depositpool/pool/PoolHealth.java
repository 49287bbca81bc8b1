package com.depositpool.pool;

public enum PoolHealth {
    EXCELLENT,
    HIGH_UTILIZATION,
    WARNING,
    CRITICAL
}
