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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scored finding for one transfer and one rule. {@code resolved} belongs to the analyst workflow
 * and is never written by the scorer after insert.
 */
@Document(collection = "anomalies")
@CompoundIndexes({
        @CompoundIndex(name = "transfer_type", def = "{'transferId': 1, 'anomalyType': 1}", unique = true),
        @CompoundIndex(name = "chain_block", def = "{'chainId': 1, 'blockNumber': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Anomaly {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String transferId;
    private long chainId;
    private long blockNumber;
    private AnomalyType anomalyType;
    /** In [0, 1]. */
    private double riskScore;
    private List<String> flags = new ArrayList<>();
    private Map<String, Object> details = new LinkedHashMap<>();
    private String address;
    private Instant detectedAt;
    private boolean resolved;

    public static String idOf(String transferId, AnomalyType type) {
        return transferId + ":" + type.name();
    }
}
