package com.chainwatch.domain;

public enum TransferSide {
    FROM,
    TO
}
