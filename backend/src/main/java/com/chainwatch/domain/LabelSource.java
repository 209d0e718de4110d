package com.chainwatch.domain;

/**
 * Origin of an entity label. Labels from OFAC_SDN are treated as sanctioned regardless of entity type.
 */
public enum LabelSource {
    OFAC_SDN,
    CONFIG,
    HEURISTIC,
    CUSTOM_WATCHLIST
}
