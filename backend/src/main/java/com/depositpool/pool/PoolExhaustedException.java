package com.depositpool.pool;

/**
 * No AVAILABLE address at allocation time. Callers decide whether to retry; replenishment is already triggered.
 */
public class PoolExhaustedException extends RuntimeException {

    public PoolExhaustedException(String message) {
        super(message);
    }
}
