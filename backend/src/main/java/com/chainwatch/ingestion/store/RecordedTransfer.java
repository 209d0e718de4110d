package com.chainwatch.ingestion.store;

import com.chainwatch.domain.Transfer;

/**
 * Durable transfer returned by the recorder, whether this call inserted it or not.
 */
public record RecordedTransfer(Transfer transfer, boolean newlyInserted) {

    public String id() {
        return transfer.getId();
    }
}
