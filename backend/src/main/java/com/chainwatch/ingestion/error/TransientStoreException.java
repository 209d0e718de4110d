package com.chainwatch.ingestion.error;

import com.chainwatch.domain.IngestionErrorKind;

/**
 * Store unavailable or a transaction aborted; the block is retried from the unchanged checkpoint.
 */
public class TransientStoreException extends IngestionException {

    public TransientStoreException(long chainId, String message, Throwable cause) {
        super(IngestionErrorKind.TRANSIENT_STORE, chainId, message, cause);
    }
}
