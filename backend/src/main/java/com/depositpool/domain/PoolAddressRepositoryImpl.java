package com.depositpool.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed atomic transitions for pool_addresses. Document-level atomicity of findAndModify
 * is what guarantees at most one assignment per address.
 */
@Repository
@RequiredArgsConstructor
public class PoolAddressRepositoryImpl implements PoolAddressRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<PoolAddress> claimNextAvailable(String depositId, Instant now) {
        Query query = new Query(where("status").is(AddressStatus.AVAILABLE))
                .with(Sort.by(Sort.Order.asc("lastReleasedAt"), Sort.Order.asc("poolSeq")));
        Update update = new Update()
                .set("status", AddressStatus.ASSIGNED)
                .set("assignedDepositId", depositId)
                .set("assignedAt", now)
                .unset("cooldownUntil")
                .inc("usageCount", 1);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), PoolAddress.class));
    }

    @Override
    public Optional<PoolAddress> markMonitoring(String address, String depositId) {
        Query query = new Query(where("_id").is(address)
                .and("status").is(AddressStatus.ASSIGNED)
                .and("assignedDepositId").is(depositId));
        Update update = new Update().set("status", AddressStatus.MONITORING);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), PoolAddress.class));
    }

    @Override
    public Optional<PoolAddress> markCooldown(String address, String depositId, Instant cooldownUntil) {
        Query query = new Query(where("_id").is(address)
                .and("status").in(List.of(AddressStatus.ASSIGNED, AddressStatus.MONITORING))
                .and("assignedDepositId").is(depositId));
        Update update = new Update()
                .set("status", AddressStatus.COOLDOWN)
                .set("cooldownUntil", cooldownUntil);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), PoolAddress.class));
    }

    @Override
    public Optional<PoolAddress> markAvailable(String address, Instant releasedAt) {
        Query query = new Query(where("_id").is(address).and("status").is(AddressStatus.COOLDOWN));
        Update update = new Update()
                .set("status", AddressStatus.AVAILABLE)
                .set("lastReleasedAt", releasedAt)
                .unset("assignedDepositId")
                .unset("assignedAt")
                .unset("cooldownUntil");
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(false), PoolAddress.class));
    }

    @Override
    public long nextPoolSeq() {
        Query query = new Query(where("_id").is(PoolSequence.POOL_ADDRESS_SEQ));
        Update update = new Update().inc("value", 1);
        PoolSequence seq = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true).upsert(true), PoolSequence.class);
        return seq != null ? seq.getValue() : 1L;
    }
}
