package com.chainwatch.anomaly.rule;

import com.chainwatch.anomaly.AnomalyFinding;
import com.chainwatch.anomaly.AnomalyRule;
import com.chainwatch.anomaly.TokenAmounts;
import com.chainwatch.anomaly.WalletContext;
import com.chainwatch.anomaly.config.AnomalyProperties;
import com.chainwatch.domain.AnomalyType;
import com.chainwatch.domain.Transfer;
import com.chainwatch.domain.WalletGraphEdge;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Funds go back along an edge that was active shortly before: receiver paid the sender within the window.
 */
@Component
@Order(700)
@RequiredArgsConstructor
public class RoundTripRule implements AnomalyRule {

    private static final BigDecimal SIMILARITY = new BigDecimal("0.10");

    private final AnomalyProperties properties;

    @Override
    public AnomalyType type() {
        return AnomalyType.ROUND_TRIP;
    }

    @Override
    public Optional<AnomalyFinding> evaluate(Transfer transfer, WalletContext context) {
        WalletGraphEdge reverse = context.reverseEdge();
        if (reverse == null || reverse.getLastSeen() == null || reverse.getTransferCount() <= 0
                || transfer.getFromAddress().equals(transfer.getToAddress())) {
            return Optional.empty();
        }
        Instant ts = transfer.getBlockTimestamp();
        Duration window = properties.getRoundTrip().getWindow();
        Duration gap = Duration.between(reverse.getLastSeen(), ts);
        if (gap.isNegative() || gap.compareTo(window) > 0) {
            return Optional.empty();
        }
        BigDecimal reverseAverageRaw = reverse.getTotalAmount()
                .divide(BigDecimal.valueOf(reverse.getTransferCount()), MathContext.DECIMAL64);
        BigDecimal reverseAverage = TokenAmounts.toHuman(reverseAverageRaw, transfer.getTokenDecimals());
        BigDecimal amount = context.humanAmount();
        boolean similar = reverseAverage.signum() > 0
                && amount.subtract(reverseAverage).abs().compareTo(reverseAverage.multiply(SIMILARITY)) <= 0;
        double score = similar ? 0.7 : 0.5;
        return Optional.of(new AnomalyFinding(type(), score,
                similar ? List.of("round_trip_within_" + window.toSeconds() + "s", "similar_amount")
                        : List.of("round_trip_within_" + window.toSeconds() + "s"),
                Map.of("gapSecs", gap.toSeconds(), "reverseAverage", reverseAverage.toPlainString()),
                transfer.getFromAddress()));
    }
}
