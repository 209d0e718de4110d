package com.chainwatch.domain;

public enum EntityType {
    EXCHANGE,
    COMPANY,
    INDIVIDUAL,
    CONTRACT,
    MIXER,
    SANCTIONED,
    UNKNOWN
}
