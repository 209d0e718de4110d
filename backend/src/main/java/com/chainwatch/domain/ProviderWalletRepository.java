package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface ProviderWalletRepository extends MongoRepository<ProviderWallet, String> {

    Optional<ProviderWallet> findByChainIdAndAddress(long chainId, String address);
}
