package com.chainwatch.ingestion.pipeline;

import com.chainwatch.anomaly.AnomalyScorer;
import com.chainwatch.attribution.EntityAttributor;
import com.chainwatch.domain.Transfer;
import com.chainwatch.graph.GraphAggregator;
import com.chainwatch.ingestion.store.RecordedTransfer;
import com.chainwatch.ingestion.store.TransferRecorder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Fans a recorded transfer out to the derived views: graph, attribution, then anomaly scoring.
 * Safe to replay: the graph step is guarded by the absorption marker, the others upsert.
 */
@Component
@RequiredArgsConstructor
public class TransferEnrichment {

    private final TransferRecorder transferRecorder;
    private final GraphAggregator graphAggregator;
    private final EntityAttributor entityAttributor;
    private final AnomalyScorer anomalyScorer;

    public void enrich(RecordedTransfer recorded) {
        Transfer transfer = recorded.transfer();
        if (transferRecorder.claimGraphAbsorption(transfer.getId())) {
            graphAggregator.absorb(transfer);
        }
        entityAttributor.attribute(transfer);
        anomalyScorer.score(transfer);
    }
}
