package com.depositpool.domain;

/**
 * Lifecycle of a pool address within one assignment cycle:
 * AVAILABLE → ASSIGNED → MONITORING → COOLDOWN → AVAILABLE.
 */
public enum AddressStatus {
    AVAILABLE,
    ASSIGNED,
    MONITORING,
    COOLDOWN;

    /** Held by a deposit (assignedDepositId is set). */
    public boolean isHeld() {
        return this != AVAILABLE;
    }
}
