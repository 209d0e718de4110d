package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface OnrampProviderRepository extends MongoRepository<OnrampProvider, String> {
}
