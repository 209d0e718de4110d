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
 * Directed wallet-pair aggregate. Always equals the totals over the live transfers of the pair.
 */
@Document(collection = "wallet_graph_edges")
@CompoundIndexes({
        @CompoundIndex(name = "pair_chain", def = "{'sourceAddress': 1, 'destAddress': 1, 'chainId': 1}", unique = true),
        @CompoundIndex(name = "chain_dest", def = "{'chainId': 1, 'destAddress': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WalletGraphEdge {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String sourceAddress;
    private String destAddress;
    private long chainId;
    private long transferCount;
    private BigDecimal totalAmount;
    private Instant firstSeen;
    private Instant lastSeen;

    public static String idOf(long chainId, String sourceAddress, String destAddress) {
        return chainId + ":" + sourceAddress + ":" + destAddress;
    }
}
