package com.chainwatch.anomaly.rule;

import com.chainwatch.anomaly.AnomalyFinding;
import com.chainwatch.anomaly.AnomalyRule;
import com.chainwatch.anomaly.WalletContext;
import com.chainwatch.anomaly.config.AnomalyProperties;
import com.chainwatch.domain.AnomalyType;
import com.chainwatch.domain.FirstSeenDirection;
import com.chainwatch.domain.Transfer;
import com.chainwatch.domain.WalletFirstSeen;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Receiver's first appearance on the chain is this transfer, and it is large.
 * Keyed off the first-seen record, so re-evaluation gives the same answer.
 */
@Component
@Order(600)
@RequiredArgsConstructor
public class NewWalletLargeReceiveRule implements AnomalyRule {

    private final AnomalyProperties properties;

    @Override
    public AnomalyType type() {
        return AnomalyType.NEW_WALLET_LARGE_RECEIVE;
    }

    @Override
    public Optional<AnomalyFinding> evaluate(Transfer transfer, WalletContext context) {
        WalletFirstSeen firstSeen = context.receiverFirstSeen();
        if (firstSeen == null
                || firstSeen.getFirstDirection() != FirstSeenDirection.IN
                || firstSeen.getFirstBlock() != transfer.getBlockNumber()
                || !transfer.getTxHash().equals(firstSeen.getFirstTxHash())) {
            return Optional.empty();
        }
        BigDecimal threshold = properties.getNewWallet().getThreshold();
        BigDecimal amount = context.humanAmount();
        if (amount.compareTo(threshold) < 0) {
            return Optional.empty();
        }
        double score = amount.compareTo(threshold.multiply(BigDecimal.TEN)) >= 0 ? 0.8 : 0.6;
        return Optional.of(new AnomalyFinding(type(), score,
                List.of("new_wallet_large_receive"),
                Map.of("amount", amount.toPlainString(), "threshold", threshold.toPlainString()),
                transfer.getToAddress()));
    }
}
