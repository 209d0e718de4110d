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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sender exceeded the allowed number of outgoing transfers within the window.
 */
@Component
@Order(200)
@RequiredArgsConstructor
public class VelocityRule implements AnomalyRule {

    private final AnomalyProperties properties;

    @Override
    public AnomalyType type() {
        return AnomalyType.VELOCITY;
    }

    @Override
    public Optional<AnomalyFinding> evaluate(Transfer transfer, WalletContext context) {
        int max = properties.getVelocity().getMaxTransfers();
        long count = context.senderTransfersInWindow();
        if (count <= max) {
            return Optional.empty();
        }
        long windowSecs = properties.getVelocity().getWindow().toSeconds();
        double score = count > 5L * max ? 0.7 : 0.5;
        return Optional.of(new AnomalyFinding(type(), score,
                List.of("high_velocity_" + count + "_in_" + windowSecs + "s"),
                Map.of("transferCount", count, "maxTransfers", max, "windowSecs", windowSecs),
                transfer.getFromAddress()));
    }
}
