package com.chainwatch.domain;

/**
 * Side on which a wallet was first observed: OUT as sender, IN as receiver.
 */
public enum FirstSeenDirection {
    IN,
    OUT
}
