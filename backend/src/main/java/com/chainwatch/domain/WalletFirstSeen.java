package com.chainwatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * First observation of a wallet on a chain. First write wins; only rollback re-derives it.
 */
@Document(collection = "wallet_first_seen")
@CompoundIndex(name = "address_chain", def = "{'address': 1, 'chainId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WalletFirstSeen {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String address;
    private long chainId;
    private Instant firstSeenAt;
    private long firstBlock;
    private String firstTxHash;
    private FirstSeenDirection firstDirection;

    public static String idOf(long chainId, String address) {
        return chainId + ":" + address;
    }
}
