package com.depositpool.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Address Pool Store. Plain reads are derived queries; every status change goes through
 * {@link PoolAddressRepositoryCustom} so it is a single atomic compare-and-set.
 */
public interface PoolAddressRepository extends MongoRepository<PoolAddress, String>, PoolAddressRepositoryCustom {

    long countByStatus(AddressStatus status);

    List<PoolAddress> findByStatusIn(Collection<AddressStatus> statuses);

    /** Cooled-down addresses due for release. */
    List<PoolAddress> findByStatusAndCooldownUntilLessThanEqual(AddressStatus status, Instant cutoff);
}
