package com.chainwatch.anomaly.rule;

import com.chainwatch.anomaly.WalletContext;
import com.chainwatch.domain.Transfer;
import com.chainwatch.domain.WalletFirstSeen;
import com.chainwatch.domain.WalletGraphEdge;

import java.math.BigDecimal;
import java.time.Instant;

final class RuleFixtures {

    static final Instant TS = Instant.parse("2025-03-01T12:00:00Z");

    private RuleFixtures() {
    }

    /** USDC-style transfer (6 decimals) of the given whole-token amount. */
    static Transfer transfer(String wholeTokens) {
        Transfer t = new Transfer();
        t.setId(Transfer.idOf(1L, "0xtx", 0));
        t.setChainId(1L);
        t.setBlockNumber(100L);
        t.setTxHash("0xtx");
        t.setLogIndex(0);
        t.setFromAddress("0xfrom");
        t.setToAddress("0xto");
        t.setTokenSymbol("USDC");
        t.setTokenDecimals(6);
        t.setAmount(new BigDecimal(wholeTokens).movePointRight(6));
        t.setBlockTimestamp(TS);
        return t;
    }

    static WalletContext context(String wholeTokens) {
        return new WalletContext(new BigDecimal(wholeTokens), 1, null, null, false, false, null);
    }

    static WalletContext withVelocity(String wholeTokens, long count) {
        return new WalletContext(new BigDecimal(wholeTokens), count, null, null, false, false, null);
    }

    static WalletContext withFirstSeen(String wholeTokens, WalletFirstSeen firstSeen) {
        return new WalletContext(new BigDecimal(wholeTokens), 1, firstSeen, null, false, false, null);
    }

    static WalletContext withReverseEdge(String wholeTokens, WalletGraphEdge edge) {
        return new WalletContext(new BigDecimal(wholeTokens), 1, null, edge, false, false, null);
    }

    static WalletContext sanctioned(boolean from, boolean to, String funder) {
        return new WalletContext(BigDecimal.TEN, 1, null, null, from, to, funder);
    }
}
