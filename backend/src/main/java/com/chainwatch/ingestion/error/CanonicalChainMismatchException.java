package com.chainwatch.ingestion.error;

import com.chainwatch.domain.IngestionErrorKind;

/**
 * The canonical chain changed while walking back to a common ancestor. Retried.
 */
public class CanonicalChainMismatchException extends IngestionException {

    public CanonicalChainMismatchException(long chainId, long blockNumber, String expectedHash, String actualHash) {
        super(IngestionErrorKind.CHAIN_MOVED, chainId,
                "Canonical header at " + blockNumber + " on chain " + chainId + " is " + actualHash + ", expected " + expectedHash);
    }

    public CanonicalChainMismatchException(long chainId, long blockNumber) {
        super(IngestionErrorKind.CHAIN_MOVED, chainId,
                "Canonical header at " + blockNumber + " on chain " + chainId + " is unavailable");
    }
}
