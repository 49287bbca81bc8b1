package com.depositpool.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One deposit address in the pool. The chain address string is the document id (immutable, unique).
 * Status is only changed by PoolManager through conditional findAndModify updates.
 */
@Document(collection = "pool_addresses")
@CompoundIndex(name = "status_fifo", def = "{'status': 1, 'lastReleasedAt': 1, 'poolSeq': 1}")
@CompoundIndex(name = "status_cooldown", def = "{'status': 1, 'cooldownUntil': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PoolAddress {

    @Id
    @EqualsAndHashCode.Include
    private String address;
    private AddressStatus status;
    /** Non-null exactly while the address is held (ASSIGNED, MONITORING, COOLDOWN). */
    private String assignedDepositId;
    private Instant assignedAt;
    /** Null until first release; never-released addresses are allocated first. */
    private Instant lastReleasedAt;
    private Instant cooldownUntil;
    /** Insertion order; FIFO tie-break when lastReleasedAt is equal. */
    private long poolSeq;
    private int usageCount;
    private Instant createdAt;

    public static PoolAddress available(String address, long poolSeq, Instant createdAt) {
        PoolAddress a = new PoolAddress();
        a.setAddress(address);
        a.setStatus(AddressStatus.AVAILABLE);
        a.setPoolSeq(poolSeq);
        a.setCreatedAt(createdAt);
        return a;
    }
}
