package com.depositpool.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A payment request waiting for an on-chain transfer to its assigned address.
 * State and confirmations are only advanced by DepositMonitor; every save is guarded by {@link #version}.
 * Events produced by a state change are written to {@link #unpublishedEvents} in the same save (outbox).
 */
@Document(collection = "deposit_requests")
@CompoundIndex(name = "state_expires", def = "{'state': 1, 'expiresAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DepositRequest {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Version
    private Long version;
    private BigDecimal requestedAmount;
    /** Asset symbol, e.g. USDT or TRX. */
    private String currency;
    /** Set once at creation. */
    @Indexed
    private String address;
    private DepositState state;
    private long confirmationsObserved;
    private BigDecimal receivedAmount = BigDecimal.ZERO;
    /** txHash → credited transfer; the hash is the idempotency key. */
    private Map<String, CreditedTransfer> credited = new LinkedHashMap<>();
    /** Lower bound passed to the chain client; null means from the start of the provider's window. */
    private Long scanFromBlock;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant lastPolledAt;
    private Instant completedAt;
    private List<DepositEventType> unpublishedEvents = new ArrayList<>();

    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }

    public void setCredited(Map<String, CreditedTransfer> credited) {
        this.credited = credited != null ? credited : new LinkedHashMap<>();
    }

    public void setUnpublishedEvents(List<DepositEventType> unpublishedEvents) {
        this.unpublishedEvents = unpublishedEvents != null ? unpublishedEvents : new ArrayList<>();
    }
}
