package com.chainwatch.anomaly.rule;

import com.chainwatch.anomaly.AnomalyFinding;
import com.chainwatch.anomaly.AnomalyRule;
import com.chainwatch.anomaly.WalletContext;
import com.chainwatch.domain.AnomalyType;
import com.chainwatch.domain.Transfer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sender was funded by a sanctioned address (one hop back in the graph).
 */
@Component
@Order(400)
public class SanctionedProximityRule implements AnomalyRule {

    @Override
    public AnomalyType type() {
        return AnomalyType.SANCTIONED_PROXIMITY;
    }

    @Override
    public Optional<AnomalyFinding> evaluate(Transfer transfer, WalletContext context) {
        if (context.sanctionedFunder() == null) {
            return Optional.empty();
        }
        return Optional.of(new AnomalyFinding(type(), 0.6,
                List.of("funded_by_sanctioned_address"),
                Map.of("sanctionedFunder", context.sanctionedFunder()),
                transfer.getFromAddress()));
    }
}
