package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface WalletClusterRepository extends MongoRepository<WalletCluster, String> {

    List<WalletCluster> findByChainId(long chainId);

    long deleteByChainIdAndGenerationNot(long chainId, long generation);
}
