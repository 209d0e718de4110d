package com.chainwatch.ingestion.job;

import com.chainwatch.domain.ChainCheckpoint;
import com.chainwatch.domain.IngestionErrorKind;
import com.chainwatch.domain.NetworkId;
import com.chainwatch.ingestion.checkpoint.CheckpointStore;
import com.chainwatch.ingestion.config.IngestionChainProperties.ChainIngestionEntry;
import com.chainwatch.ingestion.error.IngestionException;
import com.chainwatch.ingestion.error.TransientStoreException;
import com.chainwatch.ingestion.health.ChainHealthTracker;
import com.chainwatch.ingestion.pipeline.AdvanceResult;
import com.chainwatch.ingestion.pipeline.BlockIngestionService;
import com.chainwatch.ingestion.source.BlockSource;
import com.chainwatch.ingestion.source.FetchedBlock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sequential watcher for one chain. It is the only writer of that chain's checkpoint; every block
 * goes through {@link #submit} under the task's lock, so a rollback pauses new fetches until it ends.
 */
@Slf4j
public class ChainIngestionTask implements Runnable {

    private final NetworkId network;
    private final ChainIngestionEntry config;
    private final BlockSource blockSource;
    private final BlockIngestionService ingestionService;
    private final CheckpointStore checkpointStore;
    private final ChainHealthTracker healthTracker;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean running = true;

    public ChainIngestionTask(NetworkId network, ChainIngestionEntry config, BlockSource blockSource,
                              BlockIngestionService ingestionService, CheckpointStore checkpointStore,
                              ChainHealthTracker healthTracker) {
        this.network = network;
        this.config = config;
        this.blockSource = blockSource;
        this.ingestionService = ingestionService;
        this.checkpointStore = checkpointStore;
        this.healthTracker = healthTracker;
    }

    public NetworkId getNetwork() {
        return network;
    }

    public void stop() {
        running = false;
    }

    @Override
    public void run() {
        log.info("{} ingestion started", network);
        while (running) {
            long sleepMs = step();
            if (sleepMs > 0 && !pause(sleepMs)) {
                break;
            }
        }
        log.info("{} ingestion stopped", network);
    }

    /**
     * One iteration of the loop. Returns how long to wait before the next one.
     */
    long step() {
        if (healthTracker.isHalted(network)) {
            return config.getPollIntervalMs();
        }
        try {
            ChainCheckpoint checkpoint = ensureCheckpoint();
            long next = checkpoint.getLastIndexedBlock() + 1;
            if (next > blockSource.getLatestBlockNumber(network)) {
                return config.getPollIntervalMs();
            }
            Optional<FetchedBlock> block = blockSource.fetchBlock(network, next);
            if (block.isEmpty()) {
                return config.getPollIntervalMs();
            }
            submit(block.get());
            return 0;
        } catch (IngestionException e) {
            return handleFailure(e.getKind(), e);
        } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
            return handleFailure(IngestionErrorKind.TRANSIENT_STORE, e);
        } catch (RuntimeException e) {
            log.error("{} unexpected ingestion failure", network, e);
            return handleFailure(IngestionErrorKind.UNEXPECTED, e);
        }
    }

    /**
     * Feed one block to the pipeline under the chain lock and record health on success.
     *
     * @throws TransientStoreException the store was unavailable; nothing was committed
     */
    public AdvanceResult submit(FetchedBlock block) {
        lock.lock();
        try {
            AdvanceResult result;
            try {
                result = ingestionService.advance(network, block, blockSource.canonicalView(network));
            } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
                throw new TransientStoreException(network.getChainId(),
                        "Store unavailable at block " + block.number() + ": " + e.getMessage(), e);
            }
            if (result.outcome() == AdvanceResult.Outcome.ROLLED_BACK) {
                healthTracker.recordRollback(network, result.rollback().commonAncestor());
            } else if (result.outcome() == AdvanceResult.Outcome.EXTENDED) {
                healthTracker.markHealthy(network, result.blockNumber());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private ChainCheckpoint ensureCheckpoint() {
        long chainId = network.getChainId();
        Optional<ChainCheckpoint> existing = checkpointStore.find(chainId);
        if (existing.isPresent()) {
            return existing.get();
        }
        long start = config.getStartBlock() != null ? config.getStartBlock() : blockSource.getLatestBlockNumber(network);
        log.info("{} has no checkpoint, starting at block {}", network, start);
        return checkpointStore.initializeIfAbsent(chainId, start);
    }

    private long handleFailure(IngestionErrorKind kind, Exception e) {
        if (kind.isHalting()) {
            log.warn("{} ingestion halted ({}): {}", network, kind, e.getMessage());
            healthTracker.markHalted(network, kind, e.getMessage());
            return config.getPollIntervalMs();
        }
        long delayMs = healthTracker.markRetrying(network, kind, e.getMessage());
        log.warn("{} ingestion failed ({}), retrying in {} ms: {}", network, kind, delayMs, e.getMessage());
        return delayMs;
    }

    private boolean pause(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
            return false;
        }
    }
}
