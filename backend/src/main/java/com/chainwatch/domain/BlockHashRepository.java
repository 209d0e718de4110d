package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface BlockHashRepository extends MongoRepository<BlockHash, String> {

    Optional<BlockHash> findByChainIdAndBlockNumber(long chainId, long blockNumber);

    long countByChainId(long chainId);
}
