package com.chainwatch.ingestion.job;

import com.chainwatch.domain.ChainCheckpoint;
import com.chainwatch.domain.ChainCheckpointRepository;
import com.chainwatch.graph.WalletClusterer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically recomputes wallet clusters for every chain that has a checkpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "chainwatch.clustering", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WalletClusterJob {

    private final ChainCheckpointRepository checkpointRepository;
    private final WalletClusterer walletClusterer;

    @Scheduled(fixedDelayString = "${chainwatch.clustering.interval-ms:600000}",
            initialDelayString = "${chainwatch.clustering.interval-ms:600000}")
    public void recluster() {
        for (ChainCheckpoint checkpoint : checkpointRepository.findAll()) {
            try {
                walletClusterer.recluster(checkpoint.getChainId());
            } catch (RuntimeException e) {
                log.warn("Clustering failed for chain {}: {}", checkpoint.getChainId(), e.getMessage(), e);
            }
        }
    }
}
