package com.chainwatch.domain;

/**
 * Reference table a TransferEntityFlag points into.
 */
public enum AttributionSourceType {
    ENTITY_LABEL,
    WATCHLIST
}
