package com.chainwatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Cluster membership of a wallet on a chain. Rewritten per chain by the clustering job; rows of an
 * older generation are stale.
 */
@Document(collection = "wallet_clusters")
@CompoundIndexes({
        @CompoundIndex(name = "address_chain", def = "{'address': 1, 'chainId': 1}", unique = true),
        @CompoundIndex(name = "chain_generation", def = "{'chainId': 1, 'generation': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WalletCluster {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String address;
    private long chainId;
    /** Smallest member address of the cluster. */
    private String clusterId;
    /** Epoch millis of the clustering run that wrote the row. */
    private long generation;
    private Instant assignedAt;
}
