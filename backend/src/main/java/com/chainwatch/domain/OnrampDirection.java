package com.chainwatch.domain;

/**
 * DEPOSIT: funds went to a provider wallet. WITHDRAWAL: funds came out of one.
 */
public enum OnrampDirection {
    DEPOSIT,
    WITHDRAWAL
}
