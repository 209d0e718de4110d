package com.chainwatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Canonical transfer event. Idempotency key (chainId, txHash, logIndex), mirrored in the id.
 * Immutable once written; removed only by reorg rollback. Amount is in raw token units.
 */
@Document(collection = "transfers")
@CompoundIndexes({
        @CompoundIndex(name = "chain_tx_log", def = "{'chainId': 1, 'txHash': 1, 'logIndex': 1}", unique = true),
        @CompoundIndex(name = "chain_block", def = "{'chainId': 1, 'blockNumber': 1}"),
        @CompoundIndex(name = "chain_from_ts", def = "{'chainId': 1, 'fromAddress': 1, 'blockTimestamp': 1}"),
        @CompoundIndex(name = "chain_to_block", def = "{'chainId': 1, 'toAddress': 1, 'blockNumber': 1}"),
        @CompoundIndex(name = "chain_pair", def = "{'chainId': 1, 'fromAddress': 1, 'toAddress': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Transfer {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    private long blockNumber;
    private String blockHash;
    private String txHash;
    private int logIndex;
    private String tokenAddress;
    private String fromAddress;
    private String toAddress;
    private BigDecimal amount;
    private String tokenSymbol;
    private int tokenDecimals;
    private Instant blockTimestamp;
    /** Set once the transfer has been folded into the wallet graph. */
    private boolean graphAbsorbed;

    public static String idOf(long chainId, String txHash, int logIndex) {
        return chainId + ":" + txHash + ":" + logIndex;
    }
}
