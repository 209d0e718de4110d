package com.chainwatch.ingestion.error;

import com.chainwatch.domain.IngestionErrorKind;
import lombok.Getter;

/**
 * No common ancestor within the configured maximum reorg depth. Requires manual resolution.
 */
@Getter
public class DeepReorgException extends IngestionException {

    private final long lastIndexedBlock;
    private final int maxReorgDepth;

    public DeepReorgException(long chainId, long lastIndexedBlock, int maxReorgDepth) {
        super(IngestionErrorKind.DEEP_REORG, chainId,
                "Reorg on chain " + chainId + " exceeds max depth " + maxReorgDepth + " below block " + lastIndexedBlock);
        this.lastIndexedBlock = lastIndexedBlock;
        this.maxReorgDepth = maxReorgDepth;
    }
}
