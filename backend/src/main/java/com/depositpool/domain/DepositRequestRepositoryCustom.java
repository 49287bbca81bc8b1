package com.depositpool.domain;

import java.util.List;

/**
 * Outbox maintenance on deposit_requests. Both updates bump the version so a concurrent stale save fails and retries.
 */
public interface DepositRequestRepositoryCustom {

    /** $addToSet the event type; returns false when the deposit does not exist. */
    boolean addUnpublishedEvent(String depositId, DepositEventType type);

    void removeUnpublishedEvent(String depositId, DepositEventType type);

    /** Deposits whose outbox is non-empty, oldest first. */
    List<DepositRequest> findWithUnpublishedEvents(int limit);
}
