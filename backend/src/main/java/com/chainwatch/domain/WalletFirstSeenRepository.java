package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface WalletFirstSeenRepository extends MongoRepository<WalletFirstSeen, String> {

    Optional<WalletFirstSeen> findByAddressAndChainId(String address, long chainId);

    List<WalletFirstSeen> findByChainId(long chainId);
}
