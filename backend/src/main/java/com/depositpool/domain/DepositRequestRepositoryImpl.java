package com.depositpool.domain;

import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed outbox updates for deposit_requests.
 */
@Repository
@RequiredArgsConstructor
public class DepositRequestRepositoryImpl implements DepositRequestRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean addUnpublishedEvent(String depositId, DepositEventType type) {
        Query query = new Query(where("_id").is(depositId));
        Update update = new Update().addToSet("unpublishedEvents", type).inc("version", 1);
        UpdateResult result = mongoTemplate.updateFirst(query, update, DepositRequest.class);
        return result.getMatchedCount() > 0;
    }

    @Override
    public void removeUnpublishedEvent(String depositId, DepositEventType type) {
        Query query = new Query(where("_id").is(depositId).and("unpublishedEvents").is(type));
        Update update = new Update().pull("unpublishedEvents", type).inc("version", 1);
        mongoTemplate.updateFirst(query, update, DepositRequest.class);
    }

    @Override
    public List<DepositRequest> findWithUnpublishedEvents(int limit) {
        Query query = new Query(where("unpublishedEvents.0").exists(true))
                .with(Sort.by(Sort.Order.asc("createdAt")))
                .limit(limit);
        return mongoTemplate.find(query, DepositRequest.class);
    }
}
