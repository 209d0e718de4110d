package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TransferEntityFlagRepository extends MongoRepository<TransferEntityFlag, String> {

    List<TransferEntityFlag> findByTransferId(String transferId);
}
