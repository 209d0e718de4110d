package com.chainwatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Provider attribution of a transfer. The id is the transfer id (one-to-one).
 */
@Document(collection = "onramp_transfers")
@CompoundIndex(name = "chain_block", def = "{'chainId': 1, 'blockNumber': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class OnrampTransfer {

    @Id
    @EqualsAndHashCode.Include
    private String transferId;
    private String providerId;
    private long chainId;
    private long blockNumber;
    private OnrampDirection direction;
}
