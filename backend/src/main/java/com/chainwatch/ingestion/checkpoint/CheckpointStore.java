package com.chainwatch.ingestion.checkpoint;

import com.chainwatch.domain.BlockHash;
import com.chainwatch.domain.ChainCheckpoint;
import com.chainwatch.domain.IngestionErrorKind;
import com.chainwatch.ingestion.error.IngestionException;
import com.chainwatch.ingestion.source.BlockHeader;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Per-chain cursor and block hash ledger. The cursor only moves forward one block at a time,
 * except through {@link #resetTo} during rollback.
 */
@Service
@RequiredArgsConstructor
public class CheckpointStore {

    private final MongoTemplate mongoTemplate;

    public Optional<ChainCheckpoint> find(long chainId) {
        return Optional.ofNullable(mongoTemplate.findById(chainId, ChainCheckpoint.class));
    }

    /**
     * Create the checkpoint just below startBlock unless one exists. Returns the stored checkpoint.
     */
    public ChainCheckpoint initializeIfAbsent(long chainId, long startBlock) {
        long origin = startBlock - 1;
        Update update = new Update()
                .setOnInsert("lastIndexedBlock", origin)
                .setOnInsert("originBlock", origin)
                .setOnInsert("updatedAt", Instant.now());
        return mongoTemplate.findAndModify(
                Query.query(where("_id").is(chainId)),
                update,
                FindAndModifyOptions.options().upsert(true).returnNew(true),
                ChainCheckpoint.class);
    }

    /**
     * Move the cursor from blockNumber - 1 to blockNumber. Fails if another writer moved it first.
     */
    public void advance(long chainId, long blockNumber, String blockHash) {
        Query query = Query.query(where("_id").is(chainId).and("lastIndexedBlock").is(blockNumber - 1));
        Update update = new Update()
                .set("lastIndexedBlock", blockNumber)
                .set("lastBlockHash", blockHash)
                .set("updatedAt", Instant.now());
        UpdateResult result = mongoTemplate.updateFirst(query, update, ChainCheckpoint.class);
        if (result.getMatchedCount() == 0) {
            throw new IngestionException(IngestionErrorKind.UNEXPECTED, chainId,
                    "Checkpoint of chain " + chainId + " is not at block " + (blockNumber - 1));
        }
    }

    /**
     * Rewind the cursor to a common ancestor. Only the rollback protocol calls this.
     */
    public void resetTo(long chainId, long blockNumber, String blockHash) {
        Update update = new Update()
                .set("lastIndexedBlock", blockNumber)
                .set("lastBlockHash", blockHash)
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(Query.query(where("_id").is(chainId)), update, ChainCheckpoint.class);
    }

    public void recordBlockHash(long chainId, BlockHeader header) {
        BlockHash row = new BlockHash();
        row.setId(BlockHash.idOf(chainId, header.number()));
        row.setChainId(chainId);
        row.setBlockNumber(header.number());
        row.setBlockHash(header.hash());
        row.setParentHash(header.parentHash());
        mongoTemplate.save(row);
    }

    public Optional<String> storedHashAt(long chainId, long blockNumber) {
        BlockHash row = mongoTemplate.findById(BlockHash.idOf(chainId, blockNumber), BlockHash.class);
        return Optional.ofNullable(row).map(BlockHash::getBlockHash);
    }

    public long deleteBlockHashesAbove(long chainId, long blockNumber) {
        Query query = Query.query(where("chainId").is(chainId).and("blockNumber").gt(blockNumber));
        return mongoTemplate.remove(query, BlockHash.class).getDeletedCount();
    }

    public long pruneBlockHashesBelow(long chainId, long blockNumber) {
        Query query = Query.query(where("chainId").is(chainId).and("blockNumber").lt(blockNumber));
        return mongoTemplate.remove(query, BlockHash.class).getDeletedCount();
    }
}
