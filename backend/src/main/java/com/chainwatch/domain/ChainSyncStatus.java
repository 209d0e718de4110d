package com.chainwatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Health of one chain's ingestion. HALTED survives restarts until an operator sets HEALTHY.
 */
@Document(collection = "chain_sync_status")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ChainSyncStatus {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private NetworkId networkId;
    private long chainId;
    private ChainHealthStatus status;
    private Long lastSuccessfulBlock;
    private IngestionErrorKind lastErrorKind;
    private String lastErrorMessage;
    private int retryCount;
    private Instant nextRetryAfter;
    private long rollbackCount;
    private Long lastCommonAncestor;
    private Instant updatedAt;

    public enum ChainHealthStatus {
        HEALTHY,
        RETRYING,
        HALTED
    }
}
