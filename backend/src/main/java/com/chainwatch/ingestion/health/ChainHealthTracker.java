package com.chainwatch.ingestion.health;

import com.chainwatch.common.RetryPolicy;
import com.chainwatch.domain.ChainSyncStatus;
import com.chainwatch.domain.ChainSyncStatus.ChainHealthStatus;
import com.chainwatch.domain.ChainSyncStatusRepository;
import com.chainwatch.domain.IngestionErrorKind;
import com.chainwatch.domain.NetworkId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Updates chain_sync_status from the ingestion loop. Writes happen outside the block transaction,
 * so a failed block still leaves a trace.
 */
@Component
@RequiredArgsConstructor
public class ChainHealthTracker {

    private final ChainSyncStatusRepository statusRepository;
    private final RetryPolicy ingestionRetryPolicy;

    /**
     * Block committed: status HEALTHY, retry state cleared. Does not lift a HALTED status.
     */
    public void markHealthy(NetworkId network, long lastSuccessfulBlock) {
        ChainSyncStatus status = load(network);
        if (status.getStatus() == ChainHealthStatus.HALTED) {
            return;
        }
        status.setStatus(ChainHealthStatus.HEALTHY);
        status.setLastSuccessfulBlock(lastSuccessfulBlock);
        status.setRetryCount(0);
        status.setNextRetryAfter(null);
        status.setUpdatedAt(Instant.now());
        statusRepository.save(status);
    }

    /**
     * Retryable failure: status RETRYING, retryCount incremented, nextRetryAfter from the retry policy.
     * Returns the delay before the next attempt.
     */
    public long markRetrying(NetworkId network, IngestionErrorKind kind, String message) {
        ChainSyncStatus status = load(network);
        int attempt = status.getRetryCount();
        long delayMs = ingestionRetryPolicy.delayMs(attempt);
        status.setStatus(ChainHealthStatus.RETRYING);
        status.setLastErrorKind(kind);
        status.setLastErrorMessage(message);
        status.setRetryCount(attempt + 1);
        status.setNextRetryAfter(Instant.now().plusMillis(delayMs));
        status.setUpdatedAt(Instant.now());
        statusRepository.save(status);
        return delayMs;
    }

    /**
     * Non-retryable failure: status HALTED until an operator sets it back to HEALTHY.
     */
    public void markHalted(NetworkId network, IngestionErrorKind kind, String message) {
        ChainSyncStatus status = load(network);
        status.setStatus(ChainHealthStatus.HALTED);
        status.setLastErrorKind(kind);
        status.setLastErrorMessage(message);
        status.setNextRetryAfter(null);
        status.setUpdatedAt(Instant.now());
        statusRepository.save(status);
    }

    public void recordRollback(NetworkId network, long commonAncestor) {
        ChainSyncStatus status = load(network);
        status.setRollbackCount(status.getRollbackCount() + 1);
        status.setLastCommonAncestor(commonAncestor);
        status.setLastSuccessfulBlock(commonAncestor);
        status.setUpdatedAt(Instant.now());
        statusRepository.save(status);
    }

    public boolean isHalted(NetworkId network) {
        return statusRepository.findByNetworkId(network)
                .map(s -> s.getStatus() == ChainHealthStatus.HALTED)
                .orElse(false);
    }

    private ChainSyncStatus load(NetworkId network) {
        return statusRepository.findByNetworkId(network).orElseGet(() -> {
            ChainSyncStatus created = new ChainSyncStatus();
            created.setId(network.name());
            created.setNetworkId(network);
            created.setChainId(network.getChainId());
            created.setStatus(ChainHealthStatus.HEALTHY);
            return created;
        });
    }
}
