package com.chainwatch.ingestion.store;

import com.chainwatch.domain.Transfer;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.Decimal128;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Idempotent writer for transfers keyed by (chainId, txHash, logIndex).
 * A repeated key is a no-op that still returns the stored row; it never raises, so it cannot
 * abort the surrounding block transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransferRecorder {

    private final MongoTemplate mongoTemplate;

    public RecordedTransfer record(Transfer transfer) {
        String id = Transfer.idOf(transfer.getChainId(), transfer.getTxHash(), transfer.getLogIndex());
        Update update = new Update()
                .setOnInsert("chainId", transfer.getChainId())
                .setOnInsert("blockNumber", transfer.getBlockNumber())
                .setOnInsert("blockHash", transfer.getBlockHash())
                .setOnInsert("txHash", transfer.getTxHash())
                .setOnInsert("logIndex", transfer.getLogIndex())
                .setOnInsert("tokenAddress", transfer.getTokenAddress())
                .setOnInsert("fromAddress", transfer.getFromAddress())
                .setOnInsert("toAddress", transfer.getToAddress())
                .setOnInsert("amount", new Decimal128(transfer.getAmount()))
                .setOnInsert("tokenSymbol", transfer.getTokenSymbol())
                .setOnInsert("tokenDecimals", transfer.getTokenDecimals())
                .setOnInsert("blockTimestamp", transfer.getBlockTimestamp())
                .setOnInsert("graphAbsorbed", false);
        UpdateResult result = mongoTemplate.upsert(Query.query(where("_id").is(id)), update, Transfer.class);
        boolean inserted = result.getUpsertedId() != null;
        if (!inserted) {
            log.debug("Transfer {} already recorded", id);
        }
        Transfer stored = mongoTemplate.findById(id, Transfer.class);
        return new RecordedTransfer(stored, inserted);
    }

    /**
     * Atomically flip the graph marker. True only for the single caller that flipped it.
     */
    public boolean claimGraphAbsorption(String transferId) {
        Query query = Query.query(where("_id").is(transferId).and("graphAbsorbed").is(false));
        UpdateResult result = mongoTemplate.updateFirst(query, new Update().set("graphAbsorbed", true), Transfer.class);
        return result.getModifiedCount() == 1;
    }
}
