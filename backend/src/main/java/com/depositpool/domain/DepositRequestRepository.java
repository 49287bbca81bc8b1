package com.depositpool.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for deposit_requests. Saves are optimistic-locked through DepositRequest.version.
 */
public interface DepositRequestRepository extends MongoRepository<DepositRequest, String>, DepositRequestRepositoryCustom {

    /** Deposits the monitor still polls. */
    List<DepositRequest> findByStateIn(Collection<DepositState> states);

    /** The live deposit on an address; an address serves one active deposit at a time. */
    Optional<DepositRequest> findFirstByAddressAndStateInOrderByCreatedAtDesc(String address,
                                                                              Collection<DepositState> states);

    List<DepositRequest> findByStateInAndExpiresAtBefore(Collection<DepositState> states, Instant cutoff);
}
