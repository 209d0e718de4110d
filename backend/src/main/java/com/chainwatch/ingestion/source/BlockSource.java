package com.chainwatch.ingestion.source;

import com.chainwatch.domain.NetworkId;

import java.util.Optional;

/**
 * Fetches and decodes blocks for a network. Implemented outside the core (RPC + ABI decoding)
 * and plugged in as a Spring bean.
 */
public interface BlockSource {

    /**
     * Whether this source serves the given network.
     */
    boolean supports(NetworkId networkId);

    long getLatestBlockNumber(NetworkId networkId);

    /**
     * Block at the given height with its transfers, or empty when the node does not have it yet.
     */
    Optional<FetchedBlock> fetchBlock(NetworkId networkId, long blockNumber);

    default Optional<BlockHeader> fetchHeader(NetworkId networkId, long blockNumber) {
        return fetchBlock(networkId, blockNumber).map(FetchedBlock::header);
    }

    default CanonicalChainView canonicalView(NetworkId networkId) {
        return blockNumber -> fetchHeader(networkId, blockNumber);
    }
}
