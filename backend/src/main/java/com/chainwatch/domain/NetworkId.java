package com.chainwatch.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Supported EVM network with its numeric chain id.
 */
public enum NetworkId {
    ETHEREUM(1L),
    ARBITRUM(42161L),
    OPTIMISM(10L),
    POLYGON(137L),
    BASE(8453L),
    BSC(56L),
    AVALANCHE(43114L),
    MANTLE(5000L);

    private final long chainId;

    NetworkId(long chainId) {
        this.chainId = chainId;
    }

    public long getChainId() {
        return chainId;
    }

    public static Optional<NetworkId> fromChainId(long chainId) {
        return Arrays.stream(values()).filter(n -> n.chainId == chainId).findFirst();
    }
}
