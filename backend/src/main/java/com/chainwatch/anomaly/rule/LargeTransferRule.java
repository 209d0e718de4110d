package com.chainwatch.anomaly.rule;

import com.chainwatch.anomaly.AnomalyFinding;
import com.chainwatch.anomaly.AnomalyRule;
import com.chainwatch.anomaly.WalletContext;
import com.chainwatch.anomaly.config.AnomalyProperties;
import com.chainwatch.domain.AnomalyType;
import com.chainwatch.domain.Transfer;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Amount at or above the per-symbol threshold. Score grows at 5x and 10x the threshold.
 */
@Component
@Order(100)
@RequiredArgsConstructor
public class LargeTransferRule implements AnomalyRule {

    private static final BigDecimal FIVE = BigDecimal.valueOf(5);

    private final AnomalyProperties properties;

    @Override
    public AnomalyType type() {
        return AnomalyType.LARGE_TRANSFER;
    }

    @Override
    public Optional<AnomalyFinding> evaluate(Transfer transfer, WalletContext context) {
        BigDecimal threshold = properties.getLargeTransfer().thresholdFor(transfer.getTokenSymbol());
        BigDecimal amount = context.humanAmount();
        if (amount.compareTo(threshold) < 0) {
            return Optional.empty();
        }
        double score;
        if (amount.compareTo(threshold.multiply(BigDecimal.TEN)) >= 0) {
            score = 0.8;
        } else if (amount.compareTo(threshold.multiply(FIVE)) >= 0) {
            score = 0.6;
        } else {
            score = 0.4;
        }
        return Optional.of(new AnomalyFinding(type(), score,
                List.of("amount_exceeds_" + threshold.stripTrailingZeros().toPlainString()),
                Map.of("amount", amount.toPlainString(),
                        "threshold", threshold.toPlainString(),
                        "tokenSymbol", String.valueOf(transfer.getTokenSymbol())),
                transfer.getFromAddress()));
    }
}
