package com.depositpool.domain;

import java.time.Instant;
import java.util.Optional;

/**
 * Atomic status transitions on pool_addresses. Each method is one findAndModify whose filter carries the
 * expected current status (and owning deposit), so a lost race returns empty instead of double-booking.
 */
public interface PoolAddressRepositoryCustom {

    /**
     * AVAILABLE → ASSIGNED for the longest-idle address (lastReleasedAt asc, never-released first, then poolSeq asc).
     */
    Optional<PoolAddress> claimNextAvailable(String depositId, Instant now);

    /** ASSIGNED → MONITORING, only when held by depositId. */
    Optional<PoolAddress> markMonitoring(String address, String depositId);

    /** ASSIGNED or MONITORING → COOLDOWN, only when held by depositId. */
    Optional<PoolAddress> markCooldown(String address, String depositId, Instant cooldownUntil);

    /** COOLDOWN → AVAILABLE; clears the owning deposit and stamps lastReleasedAt. Returns the document before release. */
    Optional<PoolAddress> markAvailable(String address, Instant releasedAt);

    /** Next insertion sequence number (atomic $inc on pool_sequences). */
    long nextPoolSeq();
}
