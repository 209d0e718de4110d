package com.chainwatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Durable per-chain cursor. Owned exclusively by that chain's ingestion task.
 * originBlock is the height just below the first indexed block: nothing under it was recorded.
 */
@Document(collection = "chain_checkpoints")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ChainCheckpoint {

    @Id
    @EqualsAndHashCode.Include
    private Long chainId;
    private long lastIndexedBlock;
    /** Null until the first block past the origin is indexed. */
    private String lastBlockHash;
    private long originBlock;
    private Instant updatedAt;
}
