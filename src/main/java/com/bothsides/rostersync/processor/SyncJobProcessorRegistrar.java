package com.bothsides.rostersync.processor;

import com.bothsides.rostersync.model.SyncStrategy;
import com.bothsides.rostersync.queue.SyncJobQueue;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Attaches each strategy processor to its queue lane at startup
 */
@Component
public class SyncJobProcessorRegistrar {

    private static final Logger logger = LoggerFactory.getLogger(SyncJobProcessorRegistrar.class);

    private final SyncJobQueue queue;
    private final Map<SyncStrategy, AbstractSyncJobProcessor> processors = new EnumMap<>(SyncStrategy.class);

    @Value("${sync-engine.workers.full:3}")
    private int fullWorkers = SyncStrategy.FULL.getDefaultConcurrency();

    @Value("${sync-engine.workers.incremental:5}")
    private int incrementalWorkers = SyncStrategy.INCREMENTAL.getDefaultConcurrency();

    @Value("${sync-engine.workers.real-time:10}")
    private int realTimeWorkers = SyncStrategy.REAL_TIME.getDefaultConcurrency();

    @Value("${sync-engine.workers.manual:2}")
    private int manualWorkers = SyncStrategy.MANUAL.getDefaultConcurrency();

    @Autowired
    public SyncJobProcessorRegistrar(SyncJobQueue queue, List<AbstractSyncJobProcessor> processorList) {
        this.queue = queue;
        for (AbstractSyncJobProcessor processor : processorList) {
            AbstractSyncJobProcessor previous = processors.put(processor.getStrategy(), processor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate processor for strategy " + processor.getStrategy()
                        + ": " + previous.getClass().getSimpleName() + " and " + processor.getClass().getSimpleName());
            }
        }
    }

    @PostConstruct
    public void registerProcessors() {
        for (SyncStrategy strategy : SyncStrategy.values()) {
            AbstractSyncJobProcessor processor = processors.get(strategy);
            if (processor == null) {
                throw new IllegalStateException("No processor registered for strategy " + strategy);
            }
            queue.registerProcessor(strategy, concurrencyFor(strategy), processor);
        }
        logger.info("Registered sync processors for strategies {}", processors.keySet());
    }

    int concurrencyFor(SyncStrategy strategy) {
        return switch (strategy) {
            case FULL -> fullWorkers;
            case INCREMENTAL -> incrementalWorkers;
            case REAL_TIME -> realTimeWorkers;
            case MANUAL -> manualWorkers;
        };
    }
}
