package com.fhestream.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of EventStreamRecordRepositoryCustom using MongoTemplate.find.
 */
@Repository
@RequiredArgsConstructor
public class EventStreamRecordRepositoryImpl implements EventStreamRecordRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<EventStreamRecord> findAfter(Instant afterPublishedAt, String afterEventId, Long minSlot, String targetOwner, int limit) {
        List<Criteria> parts = new ArrayList<>();
        if (targetOwner != null) {
            parts.add(where("targetOwner").is(targetOwner));
        } else {
            parts.add(where("targetOwner").is(null));
        }
        if (afterPublishedAt != null && afterEventId == null) {
            parts.add(where("publishedAt").gt(afterPublishedAt));
        } else if (afterPublishedAt != null) {
            parts.add(new Criteria().orOperator(
                    where("publishedAt").gt(afterPublishedAt),
                    where("publishedAt").is(afterPublishedAt).and("_id").gt(afterEventId)));
        } else if (afterEventId != null) {
            parts.add(where("_id").gt(afterEventId));
        }
        if (minSlot != null) {
            parts.add(where("slot").gte(minSlot));
        }
        Query query = new Query(new Criteria().andOperator(parts.toArray(new Criteria[0])))
                .with(Sort.by(Sort.Order.asc("publishedAt"), Sort.Order.asc("_id")))
                .limit(limit);
        return mongoTemplate.find(query, EventStreamRecord.class);
    }
}
