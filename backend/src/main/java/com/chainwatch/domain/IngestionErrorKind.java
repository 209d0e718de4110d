package com.chainwatch.domain;

/**
 * Failure class recorded in chain health. GAP and DEEP_REORG halt the chain; the rest are retried.
 */
public enum IngestionErrorKind {
    GAP,
    DEEP_REORG,
    TRANSIENT_STORE,
    CHAIN_MOVED,
    UNEXPECTED;

    public boolean isHalting() {
        return this == GAP || this == DEEP_REORG;
    }
}
