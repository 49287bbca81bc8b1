package com.depositpool.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface DepositEventRecordRepository extends MongoRepository<DepositEventRecord, String> {

    Optional<DepositEventRecord> findByDepositIdAndType(String depositId, DepositEventType type);

    List<DepositEventRecord> findByDepositIdOrderByOccurredAtAsc(String depositId);
}
