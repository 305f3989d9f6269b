package com.fhestream.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for ciphertexts. Conditional transitions go through MongoTemplate in CiphertextService.
 */
public interface CiphertextRecordRepository extends MongoRepository<CiphertextRecord, String> {

    List<CiphertextRecord> findByOwner(String owner);
}
