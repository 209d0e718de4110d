package com.chainwatch.anomaly.rule;

import com.chainwatch.anomaly.AnomalyFinding;
import com.chainwatch.anomaly.config.AnomalyProperties;
import com.chainwatch.domain.WalletGraphEdge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RoundTripRuleTest {

    RoundTripRule rule = new RoundTripRule(new AnomalyProperties());

    private static WalletGraphEdge reverse(Duration ago, long count, String totalWholeTokens) {
        WalletGraphEdge e = new WalletGraphEdge();
        e.setSourceAddress("0xto");
        e.setDestAddress("0xfrom");
        e.setChainId(1L);
        e.setTransferCount(count);
        e.setTotalAmount(new BigDecimal(totalWholeTokens).movePointRight(6));
        e.setFirstSeen(RuleFixtures.TS.minus(ago));
        e.setLastSeen(RuleFixtures.TS.minus(ago));
        return e;
    }

    @Test
    @DisplayName("no reverse edge: silent")
    void noReverse() {
        assertThat(rule.evaluate(RuleFixtures.transfer("100"), RuleFixtures.context("100"))).isEmpty();
    }

    @Test
    @DisplayName("reverse flow inside the window with similar amount scores 0.7")
    void similarAmount() {
        AnomalyFinding f = rule.evaluate(RuleFixtures.transfer("1000"),
                RuleFixtures.withReverseEdge("1000", reverse(Duration.ofHours(2), 2, "1900"))).orElseThrow();
        assertThat(f.riskScore()).isEqualTo(0.7);
        assertThat(f.flags()).contains("similar_amount");
    }

    @Test
    @DisplayName("reverse flow inside the window with different amount scores 0.5")
    void differentAmount() {
        AnomalyFinding f = rule.evaluate(RuleFixtures.transfer("100"),
                RuleFixtures.withReverseEdge("100", reverse(Duration.ofHours(2), 1, "5000"))).orElseThrow();
        assertThat(f.riskScore()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("reverse flow older than the window: silent")
    void outsideWindow() {
        assertThat(rule.evaluate(RuleFixtures.transfer("100"),
                RuleFixtures.withReverseEdge("100", reverse(Duration.ofDays(3), 1, "100")))).isEmpty();
    }
}
