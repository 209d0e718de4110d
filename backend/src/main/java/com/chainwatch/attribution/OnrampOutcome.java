package com.chainwatch.attribution;

/**
 * Result of on-ramp attribution for one transfer. AMBIGUOUS is logged and never stored.
 */
public enum OnrampOutcome {
    NONE,
    DEPOSIT,
    WITHDRAWAL,
    AMBIGUOUS
}
