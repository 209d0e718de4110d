package com.chainwatch.anomaly;

import com.chainwatch.domain.AnomalyType;

import java.util.List;
import java.util.Map;

/**
 * Output of one rule for one transfer. riskScore is in [0, 1].
 */
public record AnomalyFinding(
        AnomalyType type,
        double riskScore,
        List<String> flags,
        Map<String, Object> details,
        String address
) {

    public AnomalyFinding {
        if (riskScore < 0.0 || riskScore > 1.0) {
            throw new IllegalArgumentException("riskScore out of [0,1]: " + riskScore);
        }
        flags = List.copyOf(flags);
        details = Map.copyOf(details);
    }
}
