package com.fhestream.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface EventStreamRecordRepository extends MongoRepository<EventStreamRecord, String>, EventStreamRecordRepositoryCustom {
}
