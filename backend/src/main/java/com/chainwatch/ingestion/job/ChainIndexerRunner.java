package com.chainwatch.ingestion.job;

import com.chainwatch.config.AsyncConfig;
import com.chainwatch.domain.NetworkId;
import com.chainwatch.ingestion.checkpoint.CheckpointStore;
import com.chainwatch.ingestion.config.IngestionChainProperties;
import com.chainwatch.ingestion.health.ChainHealthTracker;
import com.chainwatch.ingestion.pipeline.BlockIngestionService;
import com.chainwatch.ingestion.source.BlockSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Starts one {@link ChainIngestionTask} per enabled chain that has a {@link BlockSource}.
 * Chains never share a task, so a failure on one leaves the others running.
 */
@Slf4j
@Component
public class ChainIndexerRunner {

    private final ObjectProvider<BlockSource> blockSources;
    private final IngestionChainProperties chainProperties;
    private final BlockIngestionService ingestionService;
    private final CheckpointStore checkpointStore;
    private final ChainHealthTracker healthTracker;
    private final TaskExecutor ingestionExecutor;
    private final List<ChainIngestionTask> tasks = Collections.synchronizedList(new ArrayList<>());

    public ChainIndexerRunner(ObjectProvider<BlockSource> blockSources,
                              IngestionChainProperties chainProperties,
                              BlockIngestionService ingestionService,
                              CheckpointStore checkpointStore,
                              ChainHealthTracker healthTracker,
                              @Qualifier(AsyncConfig.INGESTION_EXECUTOR) TaskExecutor ingestionExecutor) {
        this.blockSources = blockSources;
        this.chainProperties = chainProperties;
        this.ingestionService = ingestionService;
        this.checkpointStore = checkpointStore;
        this.healthTracker = healthTracker;
        this.ingestionExecutor = ingestionExecutor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        List<BlockSource> sources = blockSources.orderedStream().toList();
        if (sources.isEmpty()) {
            log.warn("No BlockSource bean registered; chain ingestion not started");
            return;
        }
        for (NetworkId network : NetworkId.values()) {
            if (!chainProperties.isEnabled(network)) {
                continue;
            }
            Optional<BlockSource> source = sources.stream().filter(s -> s.supports(network)).findFirst();
            if (source.isEmpty()) {
                log.warn("{} enabled but no BlockSource supports it; skipped", network);
                continue;
            }
            ChainIngestionTask task = new ChainIngestionTask(network, chainProperties.entryFor(network), source.get(),
                    ingestionService, checkpointStore, healthTracker);
            tasks.add(task);
            ingestionExecutor.execute(task);
        }
        log.info("Started ingestion for {} chains", tasks.size());
    }

    public List<ChainIngestionTask> getTasks() {
        return List.copyOf(tasks);
    }

    @PreDestroy
    public void stop() {
        tasks.forEach(ChainIngestionTask::stop);
    }
}
