package com.chainwatch.ingestion.pipeline;

import com.chainwatch.common.Addresses;
import com.chainwatch.domain.ChainCheckpoint;
import com.chainwatch.domain.IngestionErrorKind;
import com.chainwatch.domain.NetworkId;
import com.chainwatch.domain.Transfer;
import com.chainwatch.ingestion.checkpoint.CheckpointStore;
import com.chainwatch.ingestion.checkpoint.Continuation;
import com.chainwatch.ingestion.checkpoint.ReorgDetector;
import com.chainwatch.ingestion.config.IngestionChainProperties;
import com.chainwatch.ingestion.error.IngestionException;
import com.chainwatch.ingestion.reorg.RollbackResult;
import com.chainwatch.ingestion.reorg.RollbackService;
import com.chainwatch.ingestion.source.CanonicalChainView;
import com.chainwatch.ingestion.source.FetchedBlock;
import com.chainwatch.ingestion.source.FetchedTransfer;
import com.chainwatch.ingestion.store.RecordedTransfer;
import com.chainwatch.ingestion.store.TransferRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Advances one chain by one block. Everything a block changes (transfers, derived views, hash
 * ledger, checkpoint) commits together or not at all. Callers serialize calls per chain.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlockIngestionService {

    private final CheckpointStore checkpointStore;
    private final ReorgDetector reorgDetector;
    private final RollbackService rollbackService;
    private final TransferRecorder transferRecorder;
    private final TransferEnrichment transferEnrichment;
    private final IngestionChainProperties chainProperties;

    /**
     * @param view canonical headers, consulted when the block does not extend the tip
     * @throws com.chainwatch.ingestion.error.GapException        block is ahead of the checkpoint
     * @throws com.chainwatch.ingestion.error.DeepReorgException  rollback would exceed the max depth
     */
    @Transactional
    public AdvanceResult advance(NetworkId network, FetchedBlock block, CanonicalChainView view) {
        long chainId = network.getChainId();
        ChainCheckpoint checkpoint = checkpointStore.find(chainId)
                .orElseThrow(() -> new IngestionException(IngestionErrorKind.UNEXPECTED, chainId,
                        "No checkpoint for chain " + chainId));
        FetchedBlock normalized = normalize(block);
        Continuation continuation = reorgDetector.classify(checkpoint, normalized, view);
        switch (continuation) {
            case DUPLICATE:
                return AdvanceResult.duplicate(normalized.number());
            case REORG:
                int maxDepth = chainProperties.entryFor(network).getMaxReorgDepth();
                RollbackResult rollback = rollbackService.rollback(checkpoint, normalized.header(), view, maxDepth);
                return AdvanceResult.rolledBack(normalized.number(), rollback);
            default:
                return extend(network, normalized);
        }
    }

    private AdvanceResult extend(NetworkId network, FetchedBlock block) {
        long chainId = network.getChainId();
        List<FetchedTransfer> ordered = new ArrayList<>(block.transfers());
        ordered.sort(Comparator.comparingInt(FetchedTransfer::logIndex).thenComparing(FetchedTransfer::txHash));

        List<RecordedTransfer> recorded = new ArrayList<>(ordered.size());
        for (FetchedTransfer fetched : ordered) {
            recorded.add(transferRecorder.record(toTransfer(chainId, block, fetched)));
        }
        for (RecordedTransfer r : recorded) {
            transferEnrichment.enrich(r);
        }

        checkpointStore.recordBlockHash(chainId, block.header());
        int maxDepth = chainProperties.entryFor(network).getMaxReorgDepth();
        checkpointStore.pruneBlockHashesBelow(chainId, block.number() - maxDepth);
        checkpointStore.advance(chainId, block.number(), block.hash());

        int inserted = (int) recorded.stream().filter(RecordedTransfer::newlyInserted).count();
        log.info("{} block {} indexed: {} transfers ({} new)", network, block.number(), recorded.size(), inserted);
        return AdvanceResult.extended(block.number(), inserted);
    }

    static FetchedBlock normalize(FetchedBlock block) {
        List<FetchedTransfer> transfers = new ArrayList<>(block.transfers().size());
        for (FetchedTransfer t : block.transfers()) {
            transfers.add(new FetchedTransfer(
                    Addresses.normalize(t.txHash()),
                    t.logIndex(),
                    Addresses.normalize(t.tokenAddress()),
                    Addresses.normalize(t.from()),
                    Addresses.normalize(t.to()),
                    t.amount(),
                    t.symbol(),
                    t.decimals()));
        }
        return new FetchedBlock(block.number(), Addresses.normalize(block.hash()),
                Addresses.normalize(block.parentHash()), block.timestamp(), transfers);
    }

    static Transfer toTransfer(long chainId, FetchedBlock block, FetchedTransfer fetched) {
        Transfer t = new Transfer();
        t.setId(Transfer.idOf(chainId, fetched.txHash(), fetched.logIndex()));
        t.setChainId(chainId);
        t.setBlockNumber(block.number());
        t.setBlockHash(block.hash());
        t.setTxHash(fetched.txHash());
        t.setLogIndex(fetched.logIndex());
        t.setTokenAddress(fetched.tokenAddress());
        t.setFromAddress(fetched.from());
        t.setToAddress(fetched.to());
        t.setAmount(fetched.amount());
        t.setTokenSymbol(fetched.symbol());
        t.setTokenDecimals(fetched.decimals());
        t.setBlockTimestamp(block.timestamp());
        return t;
    }
}
