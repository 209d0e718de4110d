package com.chainwatch.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface AnomalyRepository extends MongoRepository<Anomaly, String> {

    List<Anomaly> findByTransferId(String transferId);

    Optional<Anomaly> findByTransferIdAndAnomalyType(String transferId, AnomalyType anomalyType);

    List<Anomaly> findByChainIdAndBlockNumber(long chainId, long blockNumber);
}
