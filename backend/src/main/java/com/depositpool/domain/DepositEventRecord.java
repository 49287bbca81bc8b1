package com.depositpool.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Dedup ledger for lifecycle events: one row per (depositId, type). The payload is frozen at first emit
 * so redeliveries carry the same content.
 */
@Document(collection = "deposit_events")
@CompoundIndex(name = "deposit_type", def = "{'depositId': 1, 'type': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DepositEventRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String depositId;
    private DepositEventType type;
    private String address;
    private String currency;
    private BigDecimal requestedAmount;
    private BigDecimal receivedAmount;
    private long confirmationsObserved;
    private DepositState state;
    private Instant occurredAt;
    private boolean delivered;
    private int deliveryAttempts;
    private String lastError;
    private Instant deliveredAt;

    public static DepositEventRecord from(DepositLifecycleEvent event) {
        DepositEventRecord r = new DepositEventRecord();
        r.setId(event.eventId());
        r.setDepositId(event.depositId());
        r.setType(event.type());
        r.setAddress(event.address());
        r.setCurrency(event.currency());
        r.setRequestedAmount(event.requestedAmount());
        r.setReceivedAmount(event.receivedAmount());
        r.setConfirmationsObserved(event.confirmationsObserved());
        r.setState(event.state());
        r.setOccurredAt(event.occurredAt());
        return r;
    }

    public DepositLifecycleEvent toEvent() {
        return new DepositLifecycleEvent(id, type, depositId, address, currency,
                requestedAmount, receivedAmount, confirmationsObserved, state, occurredAt);
    }
}
