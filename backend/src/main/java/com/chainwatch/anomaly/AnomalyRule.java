package com.chainwatch.anomaly;

import com.chainwatch.domain.AnomalyType;
import com.chainwatch.domain.Transfer;

import java.util.Optional;

/**
 * One deterministic detection rule. Ordering between rules comes from {@code @Order}.
 */
public interface AnomalyRule {

    AnomalyType type();

    Optional<AnomalyFinding> evaluate(Transfer transfer, WalletContext context);
}
