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
 * Amount sits on (or within tolerance of) a round multiple. Larger units score higher.
 */
@Component
@Order(500)
@RequiredArgsConstructor
public class RoundNumberRule implements AnomalyRule {

    private static final List<BigDecimal> UNITS = List.of(
            new BigDecimal("100000"),
            new BigDecimal("50000"),
            new BigDecimal("25000"),
            new BigDecimal("10000"),
            new BigDecimal("5000"),
            new BigDecimal("1000"));

    private static final BigDecimal HUNDRED_K = new BigDecimal("100000");
    private static final BigDecimal TEN_K = new BigDecimal("10000");

    private final AnomalyProperties properties;

    @Override
    public AnomalyType type() {
        return AnomalyType.ROUND_NUMBER;
    }

    @Override
    public Optional<AnomalyFinding> evaluate(Transfer transfer, WalletContext context) {
        BigDecimal amount = context.humanAmount();
        AnomalyProperties.RoundNumber config = properties.getRoundNumber();
        if (amount.compareTo(config.getMinimumAmount()) < 0) {
            return Optional.empty();
        }
        for (BigDecimal unit : UNITS) {
            if (amount.compareTo(unit) < 0) {
                continue;
            }
            BigDecimal remainder = amount.remainder(unit);
            BigDecimal distance = remainder.min(unit.subtract(remainder));
            BigDecimal allowed = unit.multiply(config.getTolerance());
            if (distance.compareTo(allowed) < 0) {
                double score = unit.compareTo(HUNDRED_K) >= 0 ? 0.4 : unit.compareTo(TEN_K) >= 0 ? 0.3 : 0.2;
                String unitText = unit.toPlainString();
                return Optional.of(new AnomalyFinding(type(), score,
                        List.of("round_multiple_of_" + unitText),
                        Map.of("amount", amount.toPlainString(), "unit", unitText),
                        transfer.getFromAddress()));
            }
        }
        return Optional.empty();
    }
}
