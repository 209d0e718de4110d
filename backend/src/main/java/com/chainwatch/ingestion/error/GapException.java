package com.chainwatch.ingestion.error;

import com.chainwatch.domain.IngestionErrorKind;
import lombok.Getter;

/**
 * Block arrived ahead of the checkpoint. Missing heights must be backfilled first.
 */
@Getter
public class GapException extends IngestionException {

    private final long lastIndexedBlock;
    private final long receivedBlock;

    public GapException(long chainId, long lastIndexedBlock, long receivedBlock) {
        super(IngestionErrorKind.GAP, chainId,
                "Gap on chain " + chainId + ": last indexed " + lastIndexedBlock + ", received " + receivedBlock);
        this.lastIndexedBlock = lastIndexedBlock;
        this.receivedBlock = receivedBlock;
    }
}
