package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface ChainCheckpointRepository extends MongoRepository<ChainCheckpoint, Long> {
}
