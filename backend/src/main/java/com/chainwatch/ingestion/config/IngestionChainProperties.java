package com.chainwatch.ingestion.config;

import com.chainwatch.domain.NetworkId;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-chain ingestion config. Key = NetworkId name (e.g. ETHEREUM, ARBITRUM).
 * A network without an entry is not watched.
 */
@ConfigurationProperties(prefix = "chainwatch.ingestion")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionChainProperties {

    private Map<String, @Valid ChainIngestionEntry> chains = new HashMap<>();

    public void setChains(Map<String, ChainIngestionEntry> chains) {
        this.chains = chains != null ? chains : new HashMap<>();
    }

    /**
     * Entry for the network, or defaults when none is configured.
     */
    public ChainIngestionEntry entryFor(NetworkId networkId) {
        ChainIngestionEntry entry = chains.get(networkId.name());
        return entry != null ? entry : new ChainIngestionEntry();
    }

    public boolean isEnabled(NetworkId networkId) {
        ChainIngestionEntry entry = chains.get(networkId.name());
        return entry != null && entry.isEnabled();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class ChainIngestionEntry {

        private boolean enabled = true;
        /** First block to index when no checkpoint exists. Null starts at the source's latest block. */
        private Long startBlock;
        /** Deepest rollback attempted automatically. */
        @Min(1)
        private int maxReorgDepth = 64;
        @Min(1)
        private long pollIntervalMs = 2000L;
    }
}
