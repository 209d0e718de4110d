package com.chainwatch.anomaly;

import com.chainwatch.anomaly.config.AnomalyProperties;
import com.chainwatch.domain.Anomaly;
import com.chainwatch.domain.Transfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Runs the ordered rule chain on a transfer and upserts one Anomaly per (transfer, type).
 * Re-scoring overwrites score, flags and details; {@code resolved} is only set on insert.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnomalyScorer {

    private final List<AnomalyRule> rules;
    private final WalletContextLoader contextLoader;
    private final MongoTemplate mongoTemplate;
    private final AnomalyProperties properties;

    /**
     * Load context, evaluate and persist. Returns the findings written.
     */
    public List<AnomalyFinding> score(Transfer transfer) {
        if (!properties.isEnabled()) {
            return List.of();
        }
        WalletContext context = contextLoader.load(transfer);
        List<AnomalyFinding> findings = evaluate(transfer, context);
        for (AnomalyFinding finding : findings) {
            upsert(transfer, finding);
            log.warn("Anomaly {} on transfer {} (chain {}, block {}): score {}, flags {}",
                    finding.type(), transfer.getId(), transfer.getChainId(), transfer.getBlockNumber(),
                    finding.riskScore(), finding.flags());
        }
        return findings;
    }

    public List<AnomalyFinding> evaluate(Transfer transfer, WalletContext context) {
        List<AnomalyFinding> findings = new ArrayList<>();
        for (AnomalyRule rule : rules) {
            rule.evaluate(transfer, context).ifPresent(findings::add);
        }
        return findings;
    }

    private void upsert(Transfer transfer, AnomalyFinding finding) {
        String id = Anomaly.idOf(transfer.getId(), finding.type());
        Update update = new Update()
                .set("riskScore", finding.riskScore())
                .set("flags", finding.flags())
                .set("details", finding.details())
                .set("address", finding.address())
                .setOnInsert("transferId", transfer.getId())
                .setOnInsert("chainId", transfer.getChainId())
                .setOnInsert("blockNumber", transfer.getBlockNumber())
                .setOnInsert("anomalyType", finding.type().name())
                .setOnInsert("detectedAt", Instant.now())
                .setOnInsert("resolved", false);
        mongoTemplate.upsert(Query.query(where("_id").is(id)), update, Anomaly.class);
    }
}
