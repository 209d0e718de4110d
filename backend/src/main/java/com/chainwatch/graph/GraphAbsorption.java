package com.chainwatch.graph;

/**
 * Which sides of an absorbed transfer were seen for the first time on the chain.
 */
public record GraphAbsorption(boolean senderFirstSeen, boolean receiverFirstSeen) {
}
