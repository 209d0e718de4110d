package com.chainwatch.graph;

import com.chainwatch.domain.FirstSeenDirection;
import com.chainwatch.domain.Transfer;
import com.chainwatch.domain.WalletFirstSeen;
import com.chainwatch.domain.WalletGraphEdge;
import lombok.RequiredArgsConstructor;
import org.bson.types.Decimal128;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Folds one transfer into the first-seen records and the directed edge of its address pair.
 * Not idempotent on its own: callers absorb each durable transfer at most once.
 */
@Service
@RequiredArgsConstructor
public class GraphAggregator {

    private final MongoTemplate mongoTemplate;

    public GraphAbsorption absorb(Transfer transfer) {
        boolean senderNew = recordFirstSeen(transfer, transfer.getFromAddress(), FirstSeenDirection.OUT);
        boolean receiverNew = recordFirstSeen(transfer, transfer.getToAddress(), FirstSeenDirection.IN);
        accumulateEdge(transfer);
        return new GraphAbsorption(senderNew, receiverNew);
    }

    /** $setOnInsert upsert: first write wins, concurrent writers converge on one row. */
    private boolean recordFirstSeen(Transfer transfer, String address, FirstSeenDirection direction) {
        String id = WalletFirstSeen.idOf(transfer.getChainId(), address);
        Update update = new Update()
                .setOnInsert("address", address)
                .setOnInsert("chainId", transfer.getChainId())
                .setOnInsert("firstSeenAt", transfer.getBlockTimestamp())
                .setOnInsert("firstBlock", transfer.getBlockNumber())
                .setOnInsert("firstTxHash", transfer.getTxHash())
                .setOnInsert("firstDirection", direction.name());
        return mongoTemplate.upsert(Query.query(where("_id").is(id)), update, WalletFirstSeen.class)
                .getUpsertedId() != null;
    }

    private void accumulateEdge(Transfer transfer) {
        String id = WalletGraphEdge.idOf(transfer.getChainId(), transfer.getFromAddress(), transfer.getToAddress());
        Update update = new Update()
                .setOnInsert("sourceAddress", transfer.getFromAddress())
                .setOnInsert("destAddress", transfer.getToAddress())
                .setOnInsert("chainId", transfer.getChainId())
                .inc("transferCount", 1L)
                .inc("totalAmount", new Decimal128(transfer.getAmount()))
                .min("firstSeen", transfer.getBlockTimestamp())
                .max("lastSeen", transfer.getBlockTimestamp());
        mongoTemplate.upsert(Query.query(where("_id").is(id)), update, WalletGraphEdge.class);
    }
}
