package com.depositpool.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Application event for webhook-dispatch and ledger collaborators. Delivered at least once;
 * {@code eventId} is stable across redeliveries so consumers can deduplicate.
 */
public record DepositLifecycleEvent(
        String eventId,
        DepositEventType type,
        String depositId,
        String address,
        String currency,
        BigDecimal requestedAmount,
        BigDecimal receivedAmount,
        long confirmationsObserved,
        DepositState state,
        Instant occurredAt) {

    public static DepositLifecycleEvent of(DepositEventType type, DepositRequest deposit, Instant occurredAt) {
        return new DepositLifecycleEvent(
                deposit.getId() + ":" + type.name(),
                type,
                deposit.getId(),
                deposit.getAddress(),
                deposit.getCurrency(),
                deposit.getRequestedAmount(),
                deposit.getReceivedAmount(),
                deposit.getConfirmationsObserved(),
                deposit.getState(),
                occurredAt);
    }
}
