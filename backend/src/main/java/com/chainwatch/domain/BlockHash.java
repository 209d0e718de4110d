package com.chainwatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Hash ledger used only for reorg comparison. One row per (chainId, blockNumber).
 */
@Document(collection = "block_hashes")
@CompoundIndex(name = "chain_block", def = "{'chainId': 1, 'blockNumber': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BlockHash {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long chainId;
    private long blockNumber;
    private String blockHash;
    private String parentHash;

    public static String idOf(long chainId, long blockNumber) {
        return chainId + ":" + blockNumber;
    }
}
