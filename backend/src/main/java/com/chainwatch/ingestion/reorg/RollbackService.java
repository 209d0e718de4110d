package com.chainwatch.ingestion.reorg;

import com.chainwatch.common.Addresses;
import com.chainwatch.domain.Anomaly;
import com.chainwatch.domain.ChainCheckpoint;
import com.chainwatch.domain.OnrampTransfer;
import com.chainwatch.domain.Transfer;
import com.chainwatch.domain.TransferEntityFlag;
import com.chainwatch.domain.TransferRepository;
import com.chainwatch.graph.GraphRebuilder;
import com.chainwatch.ingestion.checkpoint.CheckpointStore;
import com.chainwatch.ingestion.error.CanonicalChainMismatchException;
import com.chainwatch.ingestion.error.DeepReorgException;
import com.chainwatch.ingestion.source.BlockHeader;
import com.chainwatch.ingestion.source.CanonicalChainView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Rewinds one chain to the deepest height where stored and canonical hashes agree.
 * <p>
 * Runs in one transaction: find the ancestor, delete dependents then transfers above it,
 * re-derive the touched graph aggregates, reset the checkpoint. A deep reorg fails before any write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RollbackService {

    private final CheckpointStore checkpointStore;
    private final TransferRepository transferRepository;
    private final GraphRebuilder graphRebuilder;
    private final MongoTemplate mongoTemplate;

    /**
     * @param trigger the competing block; its parent links are walked when it lies past the tip
     * @throws DeepReorgException              no ancestor within maxReorgDepth of the checkpoint
     * @throws CanonicalChainMismatchException the canonical chain moved during the walk
     */
    @Transactional
    public RollbackResult rollback(ChainCheckpoint checkpoint, BlockHeader trigger, CanonicalChainView view, int maxReorgDepth) {
        long chainId = checkpoint.getChainId();
        long last = checkpoint.getLastIndexedBlock();
        long ancestor = findCommonAncestor(checkpoint, trigger, view, maxReorgDepth);
        String ancestorHash = ancestor <= checkpoint.getOriginBlock()
                ? null
                : checkpointStore.storedHashAt(chainId, ancestor).orElse(null);

        List<Transfer> removed = transferRepository.findByChainIdAndBlockNumberGreaterThan(chainId, ancestor);
        Query above = Query.query(where("chainId").is(chainId).and("blockNumber").gt(ancestor));
        long anomalies = mongoTemplate.remove(above, Anomaly.class).getDeletedCount();
        mongoTemplate.remove(above, TransferEntityFlag.class);
        mongoTemplate.remove(above, OnrampTransfer.class);
        long transfers = mongoTemplate.remove(above, Transfer.class).getDeletedCount();
        checkpointStore.deleteBlockHashesAbove(chainId, ancestor);

        graphRebuilder.rebuild(chainId, removed, ancestor);
        checkpointStore.resetTo(chainId, ancestor, ancestorHash);

        long depth = last - ancestor;
        log.info("Chain {} rolled back from {} to common ancestor {} (depth {}): {} transfers, {} anomalies removed",
                chainId, last, ancestor, depth, transfers, anomalies);
        return new RollbackResult(ancestor, depth, transfers, anomalies);
    }

    /**
     * A trigger past the tip is followed through its parent links. A trigger at an indexed height
     * says nothing about the heights above it, so the walk then starts at the tip and compares
     * stored hashes with the canonical headers.
     */
    long findCommonAncestor(ChainCheckpoint checkpoint, BlockHeader trigger, CanonicalChainView view, int maxReorgDepth) {
        if (trigger.number() <= checkpoint.getLastIndexedBlock()) {
            return findCommonAncestorFromTip(checkpoint, view, maxReorgDepth);
        }
        long chainId = checkpoint.getChainId();
        long last = checkpoint.getLastIndexedBlock();
        long origin = checkpoint.getOriginBlock();
        String expected = trigger.parentHash();
        long height = trigger.number() - 1;
        while (true) {
            if (last - height > maxReorgDepth) {
                throw new DeepReorgException(chainId, last, maxReorgDepth);
            }
            if (height <= origin) {
                return origin;
            }
            Optional<String> stored = checkpointStore.storedHashAt(chainId, height);
            if (stored.isPresent() && stored.get().equals(expected)) {
                return height;
            }
            long current = height;
            BlockHeader header = view.headerAt(current)
                    .orElseThrow(() -> new CanonicalChainMismatchException(chainId, current));
            if (!header.hash().equals(expected)) {
                throw new CanonicalChainMismatchException(chainId, current, expected, header.hash());
            }
            expected = header.parentHash();
            height--;
        }
    }

    long findCommonAncestorFromTip(ChainCheckpoint checkpoint, CanonicalChainView view, int maxReorgDepth) {
        long chainId = checkpoint.getChainId();
        long last = checkpoint.getLastIndexedBlock();
        long origin = checkpoint.getOriginBlock();
        String childParent = null;
        for (long height = last; ; height--) {
            if (last - height > maxReorgDepth) {
                throw new DeepReorgException(chainId, last, maxReorgDepth);
            }
            if (height <= origin) {
                return origin;
            }
            long current = height;
            BlockHeader header = view.headerAt(current)
                    .orElseThrow(() -> new CanonicalChainMismatchException(chainId, current));
            String canonical = Addresses.normalize(header.hash());
            if (childParent != null && !childParent.equals(canonical)) {
                throw new CanonicalChainMismatchException(chainId, current, childParent, canonical);
            }
            Optional<String> stored = checkpointStore.storedHashAt(chainId, current);
            if (stored.isPresent() && stored.get().equals(canonical)) {
                return current;
            }
            childParent = Addresses.normalize(header.parentHash());
        }
    }
}
