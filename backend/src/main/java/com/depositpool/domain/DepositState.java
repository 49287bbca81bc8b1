package com.depositpool.domain;

/**
 * Deposit request lifecycle. CONFIRMED, EXPIRED and FAILED are absorbing.
 */
public enum DepositState {
    PENDING,
    PARTIALLY_CONFIRMED,
    CONFIRMED,
    EXPIRED,
    FAILED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == EXPIRED || this == FAILED;
    }
}
