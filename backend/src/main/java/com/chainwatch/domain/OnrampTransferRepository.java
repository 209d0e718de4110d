package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface OnrampTransferRepository extends MongoRepository<OnrampTransfer, String> {
}
