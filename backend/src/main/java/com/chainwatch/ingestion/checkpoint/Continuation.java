package com.chainwatch.ingestion.checkpoint;

/**
 * How a fetched block relates to the stored checkpoint.
 */
public enum Continuation {
    /** Next height, parent hash matches the checkpoint. */
    LINEAR_EXTENSION,
    /** Already indexed with the same hash (or not comparable); nothing to do. */
    DUPLICATE,
    /** Hash mismatch at or below the tip; rollback required. */
    REORG
}
