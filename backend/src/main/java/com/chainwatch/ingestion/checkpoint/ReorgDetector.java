package com.chainwatch.ingestion.checkpoint;

import com.chainwatch.common.Addresses;
import com.chainwatch.domain.ChainCheckpoint;
import com.chainwatch.ingestion.error.GapException;
import com.chainwatch.ingestion.source.BlockHeader;
import com.chainwatch.ingestion.source.CanonicalChainView;
import com.chainwatch.ingestion.source.FetchedBlock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Classifies a fetched block against the checkpoint and the stored hash ledger.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReorgDetector {

    private final CheckpointStore checkpointStore;

    /**
     * @param view canonical headers; a block at an indexed height that the canonical chain does not
     *             carry is a stale uncle, not a reorg
     * @throws GapException when the block is ahead of the next expected height
     */
    public Continuation classify(ChainCheckpoint checkpoint, FetchedBlock block, CanonicalChainView view) {
        long chainId = checkpoint.getChainId();
        long last = checkpoint.getLastIndexedBlock();
        long number = block.number();

        if (number > last + 1) {
            throw new GapException(chainId, last, number);
        }
        if (number == last + 1) {
            String tipHash = checkpoint.getLastBlockHash();
            if (tipHash == null || tipHash.equals(block.parentHash())) {
                return Continuation.LINEAR_EXTENSION;
            }
            log.info("Chain {} block {} parent {} does not match tip {}", chainId, number, block.parentHash(), tipHash);
            return Continuation.REORG;
        }
        if (number <= checkpoint.getOriginBlock()) {
            log.debug("Chain {} block {} is below origin {}, ignored", chainId, number, checkpoint.getOriginBlock());
            return Continuation.DUPLICATE;
        }
        Optional<String> stored = checkpointStore.storedHashAt(chainId, number);
        if (stored.isEmpty()) {
            log.warn("Chain {} block {} has no stored hash (pruned), cannot verify; ignored", chainId, number);
            return Continuation.DUPLICATE;
        }
        if (stored.get().equals(block.hash())) {
            log.debug("Chain {} block {} already indexed", chainId, number);
            return Continuation.DUPLICATE;
        }
        Optional<String> canonical = view.headerAt(number).map(BlockHeader::hash).map(Addresses::normalize);
        if (canonical.isPresent() && canonical.get().equals(stored.get())) {
            log.info("Chain {} block {} hash {} is not canonical (canonical and stored {}), ignored",
                    chainId, number, block.hash(), stored.get());
            return Continuation.DUPLICATE;
        }
        log.info("Chain {} block {} hash {} differs from stored {}", chainId, number, block.hash(), stored.get());
        return Continuation.REORG;
    }
}
