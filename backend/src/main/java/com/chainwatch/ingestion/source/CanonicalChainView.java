package com.chainwatch.ingestion.source;

import java.util.Optional;

/**
 * Current canonical headers of one chain, consulted while walking back to a common ancestor.
 */
@FunctionalInterface
public interface CanonicalChainView {

    Optional<BlockHeader> headerAt(long blockNumber);
}
