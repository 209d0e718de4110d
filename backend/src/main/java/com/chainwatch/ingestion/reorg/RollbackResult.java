package com.chainwatch.ingestion.reorg;

/**
 * Outcome of a completed rollback: the checkpoint now sits at commonAncestor.
 */
public record RollbackResult(long commonAncestor, long depth, long deletedTransfers, long deletedAnomalies) {
}
