package com.darksite.metering.scheduler;

import com.darksite.metering.aggregation.SnapshotAggregator;
import com.darksite.metering.domain.model.Snapshot;
import com.darksite.metering.registry.MetricRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Short-interval task: collect a snapshot and publish it for serving.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CollectionJob implements Runnable {

    private final SnapshotAggregator aggregator;
    private final MetricRegistry registry;

    @Override
    public void run() {
        try {
            Snapshot snapshot = aggregator.collect();
            registry.publish(snapshot);
        } catch (RuntimeException e) {
            log.error("Collection task failed: {}", e.getMessage(), e);
        }
    }
}
