package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface ChainSyncStatusRepository extends MongoRepository<ChainSyncStatus, String> {

    Optional<ChainSyncStatus> findByNetworkId(NetworkId networkId);
}
