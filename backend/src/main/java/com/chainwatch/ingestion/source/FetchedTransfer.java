package com.chainwatch.ingestion.source;

import java.math.BigDecimal;

/**
 * Decoded token transfer log as delivered by the fetch layer. Amount is in raw token units.
 */
public record FetchedTransfer(
        String txHash,
        int logIndex,
        String tokenAddress,
        String from,
        String to,
        BigDecimal amount,
        String symbol,
        int decimals
) {
}
