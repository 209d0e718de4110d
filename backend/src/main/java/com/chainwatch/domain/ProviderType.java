package com.chainwatch.domain;

public enum ProviderType {
    EXCHANGE,
    ONRAMP,
    P2P
}
