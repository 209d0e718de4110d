package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface WalletGraphEdgeRepository extends MongoRepository<WalletGraphEdge, String> {

    Optional<WalletGraphEdge> findBySourceAddressAndDestAddressAndChainId(String sourceAddress, String destAddress, long chainId);

    List<WalletGraphEdge> findByChainId(long chainId);
}
