package com.chainwatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Links a transfer side to a matching label or watchlist entry. Unique per (transfer, source, side).
 */
@Document(collection = "transfer_entity_flags")
@CompoundIndexes({
        @CompoundIndex(name = "transfer_source_side", def = "{'transferId': 1, 'sourceType': 1, 'sourceId': 1, 'side': 1}", unique = true),
        @CompoundIndex(name = "chain_block", def = "{'chainId': 1, 'blockNumber': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TransferEntityFlag {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String transferId;
    private long chainId;
    private long blockNumber;
    private AttributionSourceType sourceType;
    private String sourceId;
    private TransferSide side;
    private String entityName;
    private EntityType entityType;

    public static String idOf(String transferId, AttributionSourceType sourceType, String sourceId, TransferSide side) {
        return transferId + ":" + sourceType.name() + ":" + sourceId + ":" + side.name();
    }
}
