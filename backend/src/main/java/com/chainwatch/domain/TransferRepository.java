package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface TransferRepository extends MongoRepository<Transfer, String> {

    Optional<Transfer> findByChainIdAndTxHashAndLogIndex(long chainId, String txHash, int logIndex);

    List<Transfer> findByChainIdAndBlockNumberGreaterThan(long chainId, long blockNumber);

    List<Transfer> findByChainIdAndFromAddressAndToAddress(long chainId, String fromAddress, String toAddress);

    List<Transfer> findByChainId(long chainId);

    long countByChainId(long chainId);
}
