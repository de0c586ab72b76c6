package com.darksite.metering.scheduler;

import com.darksite.metering.aggregation.SnapshotAggregator;
import com.darksite.metering.billing.BillingExportFile;
import com.darksite.metering.billing.BillingProjector;
import com.darksite.metering.config.MeteringProperties;
import com.darksite.metering.domain.model.BillingRow;
import com.darksite.metering.domain.model.ReportingPeriod;
import com.darksite.metering.domain.model.Snapshot;
import com.darksite.metering.registry.MetricRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Once-daily task: fresh collection, billing projection and export file.
 *
 * The export never reuses the served snapshot; it collects its own right
 * before projecting and publishes it as well. Failures are logged and counted,
 * never rethrown to the scheduler.
 */
@Component
@Slf4j
public class DailyExportJob implements Runnable {

    private final SnapshotAggregator aggregator;
    private final MetricRegistry registry;
    private final BillingProjector projector;
    private final BillingExportFile exportFile;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final MeteringProperties.Billing billing;

    public DailyExportJob(SnapshotAggregator aggregator, MetricRegistry registry, BillingProjector projector,
                          BillingExportFile exportFile, MeterRegistry meterRegistry, Clock clock,
                          MeteringProperties properties) {
        this.aggregator = aggregator;
        this.registry = registry;
        this.projector = projector;
        this.exportFile = exportFile;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.billing = properties.getBilling();
    }

    @Override
    public void run() {
        export();
    }

    /**
     * Run one export.
     *
     * @return the written file, or empty when the export failed
     */
    public Optional<Path> export() {
        Instant triggeredAt = clock.instant();
        ReportingPeriod period = ReportingPeriod.previousDay(clock);
        log.info("Starting daily export for {} - {}", period.startDate(), period.endDate());

        try {
            Snapshot snapshot = aggregator.collect();
            registry.publish(snapshot);

            List<BillingRow> rows = projector.project(snapshot, period, billing.getAccountId(), billing.getAppId());
            Path file = exportFile.write(rows, triggeredAt);

            meterRegistry.counter("metering.exports", "outcome", "success").increment();
            log.info("Daily export complete: {} rows from snapshot {} written to {}",
                    rows.size(), snapshot.getVersion(), file);
            return Optional.of(file);
        } catch (Exception e) {
            meterRegistry.counter("metering.exports", "outcome", "failure").increment();
            log.error("Daily export failed: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }
}
