package com.chainwatch.common;

import java.util.Locale;

/**
 * Normalization for hex addresses and hashes. Everything is stored lowercase with a 0x prefix.
 */
public final class Addresses {

    private Addresses() {
    }

    public static String normalize(String hex) {
        if (hex == null) {
            return null;
        }
        String trimmed = hex.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        return trimmed.startsWith("0x") ? trimmed : "0x" + trimmed;
    }
}
