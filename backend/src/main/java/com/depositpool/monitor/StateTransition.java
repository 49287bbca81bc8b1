package com.depositpool.monitor;

import com.depositpool.domain.DepositEventType;

import java.util.List;

/**
 * Result of applying observations (or expiry) to a deposit.
 *
 * @param changed true when any persisted field changed
 * @param events  lifecycle events produced, already appended to the deposit's outbox
 */
public record StateTransition(boolean changed, List<DepositEventType> events) {

    static final StateTransition NONE = new StateTransition(false, List.of());

    public boolean produced(DepositEventType type) {
        return events.contains(type);
    }
}
