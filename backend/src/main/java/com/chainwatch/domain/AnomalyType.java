package com.chainwatch.domain;

/**
 * Detection rule identifiers. One Anomaly row per (transfer, type) at most.
 */
public enum AnomalyType {
    LARGE_TRANSFER,
    VELOCITY,
    SANCTIONED_COUNTERPARTY,
    SANCTIONED_PROXIMITY,
    ROUND_NUMBER,
    NEW_WALLET_LARGE_RECEIVE,
    ROUND_TRIP
}
