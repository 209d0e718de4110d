package com.chainwatch.anomaly.rule;

import com.chainwatch.anomaly.AnomalyFinding;
import com.chainwatch.anomaly.AnomalyRule;
import com.chainwatch.anomaly.WalletContext;
import com.chainwatch.domain.AnomalyType;
import com.chainwatch.domain.Transfer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Either side is labelled sanctioned or sits on a watchlist.
 */
@Component
@Order(300)
public class SanctionedCounterpartyRule implements AnomalyRule {

    static final double RISK = 0.95;

    @Override
    public AnomalyType type() {
        return AnomalyType.SANCTIONED_COUNTERPARTY;
    }

    @Override
    public Optional<AnomalyFinding> evaluate(Transfer transfer, WalletContext context) {
        if (!context.fromSanctioned() && !context.toSanctioned()) {
            return Optional.empty();
        }
        List<String> flags = new ArrayList<>();
        if (context.fromSanctioned()) {
            flags.add("sanctioned_from_address");
        }
        if (context.toSanctioned()) {
            flags.add("sanctioned_to_address");
        }
        String address = context.fromSanctioned() ? transfer.getFromAddress() : transfer.getToAddress();
        return Optional.of(new AnomalyFinding(type(), RISK, flags,
                Map.of("fromSanctioned", context.fromSanctioned(), "toSanctioned", context.toSanctioned()),
                address));
    }
}
