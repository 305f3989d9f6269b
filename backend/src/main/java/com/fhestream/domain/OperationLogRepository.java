package com.fhestream.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for operation_log. Paged history reads go through MongoTemplate for offset paging.
 */
public interface OperationLogRepository extends MongoRepository<OperationLog, String> {

    long countByCaller(String caller);
}
