package com.chainwatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Known deposit or hot wallet of an on-ramp provider on one chain.
 */
@Document(collection = "provider_wallets")
@CompoundIndex(name = "chain_address", def = "{'chainId': 1, 'address': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ProviderWallet {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String providerId;
    private long chainId;
    private String address;
    private String label;
}
