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
 * Known entity behind an address. A null chainId makes the label global. Written by the external loader.
 */
@Document(collection = "entity_labels")
@CompoundIndex(name = "address_chain_source_name", def = "{'address': 1, 'chainId': 1, 'labelSource': 1, 'entityName': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EntityLabel {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String address;
    private Long chainId;
    private String entityName;
    private EntityType entityType;
    private LabelSource labelSource;
    private double confidence = 1.0;
    private Instant createdAt;

    public boolean isSanctioned() {
        return entityType == EntityType.SANCTIONED || labelSource == LabelSource.OFAC_SDN;
    }
}
