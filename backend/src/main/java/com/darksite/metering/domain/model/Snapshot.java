package com.darksite.metering.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Immutable result of one collection cycle.
 *
 * CONSISTENCY UNIT:
 * Metric serving and billing projection both read exactly one snapshot, never a
 * mix of records from two cycles. A snapshot is frozen on construction and is
 * never mutated after it is published.
 *
 * Version 0 is reserved for the never-collected sentinel returned by
 * {@link #empty()}.
 */
public final class Snapshot {

    private static final Snapshot EMPTY = new Snapshot(0L, Instant.EPOCH, List.of(), Map.of());

    private final long version;
    private final Instant collectedAt;
    private final List<MetricRecord> records;
    private final Map<ResourceKind, KindState> kindStates;

    public Snapshot(long version, Instant collectedAt, List<MetricRecord> records,
                    Map<ResourceKind, KindState> kindStates) {
        this.version = version;
        this.collectedAt = collectedAt;
        this.records = List.copyOf(records);
        var states = new EnumMap<ResourceKind, KindState>(ResourceKind.class);
        states.putAll(kindStates);
        this.kindStates = Collections.unmodifiableMap(states);
        requireUniqueSeries(this.records);
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    public boolean isNeverCollected() {
        return version == 0L;
    }

    public long getVersion() {
        return version;
    }

    public Instant getCollectedAt() {
        return collectedAt;
    }

    public List<MetricRecord> getRecords() {
        return records;
    }

    public Map<ResourceKind, KindState> getKindStates() {
        return kindStates;
    }

    public Optional<KindState> stateOf(ResourceKind kind) {
        return Optional.ofNullable(kindStates.get(kind));
    }

    /**
     * Status of a kind; kinds not polled in this cycle count as failed.
     */
    public KindStatus statusOf(ResourceKind kind) {
        return stateOf(kind).map(KindState::status).orElse(KindStatus.FAILED);
    }

    public Stream<MetricRecord> recordsOf(ResourceKind kind) {
        return records.stream().filter(r -> r.resource().kind() == kind);
    }

    private static void requireUniqueSeries(List<MetricRecord> records) {
        var seen = new HashSet<MetricRecord.SeriesKey>();
        for (MetricRecord record : records) {
            if (!seen.add(record.seriesKey())) {
                throw new IllegalArgumentException("Duplicate series in snapshot: "
                        + record.metricName() + record.labels());
            }
        }
    }

    @Override
    public String toString() {
        return "Snapshot{version=" + version + ", collectedAt=" + collectedAt
                + ", records=" + records.size() + ", kinds=" + kindStates + "}";
    }
}
