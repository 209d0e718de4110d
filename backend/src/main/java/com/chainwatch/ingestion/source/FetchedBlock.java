package com.chainwatch.ingestion.source;

import java.time.Instant;
import java.util.List;

/**
 * One block with its decoded transfers, as produced by a {@link BlockSource}.
 */
public record FetchedBlock(
        long number,
        String hash,
        String parentHash,
        Instant timestamp,
        List<FetchedTransfer> transfers
) {

    public FetchedBlock {
        transfers = transfers != null ? List.copyOf(transfers) : List.of();
    }

    public BlockHeader header() {
        return new BlockHeader(number, hash, parentHash);
    }
}
