package com.darksite.metering.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Canonical metric record - the common shape every API generation is reduced to.
 *
 * Units are normalized at ingestion, so consumers never see mixed units for
 * one metric name. The {@code source} generation is kept so conflicting
 * observations can be resolved by precedence; it is not part of the series key.
 */
public record MetricRecord(
        ResourceIdentity resource,
        String metricName,
        double value,
        MetricUnit unit,
        MetricLabels labels,
        Instant observedAt,
        ApiGeneration source
) {

    public MetricRecord {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(metricName, "metricName");
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(observedAt, "observedAt");
        labels = labels != null ? labels : MetricLabels.empty();
    }

    /**
     * Identity of the time series this record belongs to.
     */
    public SeriesKey seriesKey() {
        return new SeriesKey(metricName, labels);
    }

    public MetricRecord withLabels(MetricLabels newLabels) {
        return new MetricRecord(resource, metricName, value, unit, newLabels, observedAt, source);
    }

    /**
     * Metric name plus full label set; unique within one snapshot.
     */
    public record SeriesKey(String metricName, MetricLabels labels) {}
}
