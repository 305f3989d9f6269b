package com.fhestream.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface HandleDependencyRepository extends MongoRepository<HandleDependency, String> {
}
