package com.chainwatch.anomaly;

import java.math.BigDecimal;

/**
 * Raw integer token units to whole tokens.
 */
public final class TokenAmounts {

    private TokenAmounts() {
    }

    public static BigDecimal toHuman(BigDecimal raw, int decimals) {
        if (raw == null) {
            return BigDecimal.ZERO;
        }
        return raw.movePointLeft(Math.max(0, decimals));
    }
}
