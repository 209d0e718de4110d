package com.chainwatch.ingestion.pipeline;

import com.chainwatch.ingestion.reorg.RollbackResult;

/**
 * What {@link BlockIngestionService#advance} did with a block.
 *
 * @param rollback set only for ROLLED_BACK
 */
public record AdvanceResult(Outcome outcome, long blockNumber, int newTransfers, RollbackResult rollback) {

    public enum Outcome {
        EXTENDED,
        DUPLICATE,
        ROLLED_BACK
    }

    static AdvanceResult extended(long blockNumber, int newTransfers) {
        return new AdvanceResult(Outcome.EXTENDED, blockNumber, newTransfers, null);
    }

    static AdvanceResult duplicate(long blockNumber) {
        return new AdvanceResult(Outcome.DUPLICATE, blockNumber, 0, null);
    }

    static AdvanceResult rolledBack(long blockNumber, RollbackResult rollback) {
        return new AdvanceResult(Outcome.ROLLED_BACK, blockNumber, 0, rollback);
    }
}
