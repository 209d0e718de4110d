package com.chainwatch.anomaly.rule;

import com.chainwatch.anomaly.AnomalyFinding;
import com.chainwatch.anomaly.config.AnomalyProperties;
import com.chainwatch.domain.AnomalyType;
import com.chainwatch.domain.Transfer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class LargeTransferRuleTest {

    AnomalyProperties properties;
    LargeTransferRule rule;

    @BeforeEach
    void setUp() {
        properties = new AnomalyProperties();
        properties.getLargeTransfer().getThresholds().put("USDC", new BigDecimal("50000"));
        rule = new LargeTransferRule(properties);
    }

    @Test
    @DisplayName("below the symbol threshold: no finding")
    void belowThreshold() {
        assertThat(rule.evaluate(RuleFixtures.transfer("49999"), RuleFixtures.context("49999.99"))).isEmpty();
    }

    @Test
    @DisplayName("score tiers at 1x, 5x and 10x the threshold")
    void scoreTiers() {
        assertThat(score("50000")).isEqualTo(0.4);
        assertThat(score("250000")).isEqualTo(0.6);
        assertThat(score("500000")).isEqualTo(0.8);
    }

    @Test
    @DisplayName("unknown symbol falls back to the default threshold")
    void defaultThreshold() {
        Transfer t = RuleFixtures.transfer("60000");
        t.setTokenSymbol("PYUSD");
        assertThat(rule.evaluate(t, RuleFixtures.context("60000"))).isEmpty();
        assertThat(rule.evaluate(t, RuleFixtures.context("100000"))).isPresent();
    }

    @Test
    @DisplayName("finding carries type, sender and threshold details")
    void findingContents() {
        AnomalyFinding f = rule.evaluate(RuleFixtures.transfer("75000"), RuleFixtures.context("75000")).orElseThrow();
        assertThat(f.type()).isEqualTo(AnomalyType.LARGE_TRANSFER);
        assertThat(f.address()).isEqualTo("0xfrom");
        assertThat(f.flags()).containsExactly("amount_exceeds_50000");
        assertThat(f.details()).containsEntry("threshold", "50000");
    }

    private double score(String amount) {
        Optional<AnomalyFinding> f = rule.evaluate(RuleFixtures.transfer(amount), RuleFixtures.context(amount));
        return f.orElseThrow().riskScore();
    }
}
