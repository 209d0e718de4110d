package com.chainwatch.anomaly.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Detection rule thresholds. Amounts are in whole tokens (raw amount / 10^decimals).
 */
@ConfigurationProperties(prefix = "chainwatch.anomaly")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class AnomalyProperties {

    public static final String DEFAULT_THRESHOLD_KEY = "default";

    private boolean enabled = true;
    private LargeTransfer largeTransfer = new LargeTransfer();
    private Velocity velocity = new Velocity();
    private RoundNumber roundNumber = new RoundNumber();
    private NewWallet newWallet = new NewWallet();
    private RoundTrip roundTrip = new RoundTrip();
    private SanctionedProximity sanctionedProximity = new SanctionedProximity();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class LargeTransfer {

        /** Per token symbol, plus a "default" entry. */
        private Map<String, BigDecimal> thresholds = new HashMap<>(Map.of(DEFAULT_THRESHOLD_KEY, new BigDecimal("100000")));

        public BigDecimal thresholdFor(String symbol) {
            if (symbol != null) {
                BigDecimal exact = thresholds.get(symbol);
                if (exact != null) {
                    return exact;
                }
                BigDecimal upper = thresholds.get(symbol.toUpperCase(Locale.ROOT));
                if (upper != null) {
                    return upper;
                }
                BigDecimal lower = thresholds.get(symbol.toLowerCase(Locale.ROOT));
                if (lower != null) {
                    return lower;
                }
            }
            return thresholds.getOrDefault(DEFAULT_THRESHOLD_KEY, new BigDecimal("100000"));
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Velocity {

        private Duration window = Duration.ofHours(1);
        @Min(1)
        private int maxTransfers = 20;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class RoundNumber {

        private BigDecimal minimumAmount = new BigDecimal("1000");
        /** Allowed distance from a round multiple, as a fraction of the unit. */
        private BigDecimal tolerance = new BigDecimal("0.001");
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class NewWallet {

        private BigDecimal threshold = new BigDecimal("10000");
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class RoundTrip {

        private Duration window = Duration.ofHours(24);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class SanctionedProximity {

        @Min(1)
        private int maxInboundEdges = 50;
    }
}
