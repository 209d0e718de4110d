package com.chainwatch.ingestion.error;

import com.chainwatch.domain.IngestionErrorKind;
import lombok.Getter;

/**
 * Base failure of the per-chain ingestion pipeline. The kind decides between halt and retry.
 */
@Getter
public class IngestionException extends RuntimeException {

    private final IngestionErrorKind kind;
    private final long chainId;

    public IngestionException(IngestionErrorKind kind, long chainId, String message) {
        super(message);
        this.kind = kind;
        this.chainId = chainId;
    }

    public IngestionException(IngestionErrorKind kind, long chainId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.chainId = chainId;
    }
}
