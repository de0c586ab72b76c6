package com.darksite.metering.aggregation;

import com.darksite.metering.adapters.AdapterRecord;
import com.darksite.metering.adapters.EndpointAdapter;
import com.darksite.metering.adapters.MeteringException;
import com.darksite.metering.config.MeteringProperties;
import com.darksite.metering.domain.model.ApiGeneration;
import com.darksite.metering.domain.model.KindState;
import com.darksite.metering.domain.model.KindStatus;
import com.darksite.metering.domain.model.MetricLabels;
import com.darksite.metering.domain.model.MetricRecord;
import com.darksite.metering.domain.model.MetricUnit;
import com.darksite.metering.domain.model.ResourceIdentity;
import com.darksite.metering.domain.model.ResourceKind;
import com.darksite.metering.domain.model.Snapshot;
import com.darksite.metering.normalization.MetricNormalizer;
import com.darksite.metering.normalization.RecordMalformedException;
import com.darksite.metering.normalization.SourcePrecedence;
import com.darksite.metering.session.AuthExhaustedException;
import com.darksite.metering.session.SessionManager;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Runs one collection cycle across every configured route and freezes the result.
 *
 * CYCLE:
 * 1. Log in once up front; authentication exhaustion fails every kind without polling
 * 2. Drain each (kind, generation) route concurrently within the cycle budget
 * 3. Derive per-kind status: Complete, Partial (transient stop with some records) or Failed;
 *    a permanent or auth error on any route fails the kind and discards its records
 * 4. Normalize, resolve cluster names, reconcile conflicting generations
 * 5. Add derived per-cluster counts and freeze into a versioned snapshot
 *
 * No exception escapes {@link #collect()}: every adapter error ends up in the
 * snapshot's status map. A VM or host is never dropped because its cluster's
 * kind failed; its labels carry the last known cluster name or the uuid.
 */
@Service
@Slf4j
public class SnapshotAggregator {

    static final String UNKNOWN_CLUSTER = "unknown";
    static final String BUDGET_EXCEEDED = "cycle budget exceeded";

    private static final Comparator<MetricRecord> SNAPSHOT_ORDER = Comparator
            .comparing((MetricRecord r) -> r.resource().kind())
            .thenComparing(r -> r.resource().uuid())
            .thenComparing(MetricRecord::metricName)
            .thenComparing(r -> r.labels().toString());

    private final Map<ApiGeneration, EndpointAdapter> adapters;
    private final Map<ResourceKind, List<ApiGeneration>> routes;
    private final SessionManager sessionManager;
    private final MetricNormalizer normalizer;
    private final SourcePrecedence precedence;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration cycleBudget;
    private final Duration shutdownGrace;
    private final ExecutorService executor;

    private final AtomicLong versions = new AtomicLong();
    private final Map<String, String> lastKnownClusterNames = new ConcurrentHashMap<>();

    public SnapshotAggregator(Map<ApiGeneration, EndpointAdapter> adapters, SessionManager sessionManager,
                              MetricNormalizer normalizer, SourcePrecedence precedence,
                              MeterRegistry meterRegistry, Clock clock, MeteringProperties properties) {
        this.adapters = adapters;
        this.routes = validatedRoutes(properties.getRoutes(), adapters);
        this.sessionManager = sessionManager;
        this.normalizer = normalizer;
        this.precedence = precedence;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.cycleBudget = properties.getCollection().getCycleBudget();
        this.shutdownGrace = properties.getPrism().getReadTimeout();
        this.executor = Executors.newFixedThreadPool(properties.getCollection().getParallelism(),
                new ThreadFactoryBuilder().setNameFormat("metering-collect-%d").setDaemon(true).build());
    }

    /**
     * Run one full cycle and return its snapshot. Never throws for remote failures.
     */
    public Snapshot collect() {
        long version = versions.incrementAndGet();
        Instant startedAt = clock.instant();
        long deadline = System.nanoTime() + cycleBudget.toNanos();
        log.info("Collection cycle {} starting", version);

        sessionManager.beginCycle();
        try {
            return runCycle(version, startedAt, deadline);
        } finally {
            sessionManager.endCycle();
        }
    }

    private Snapshot runCycle(long version, Instant startedAt, long deadline) {
        try {
            sessionManager.acquire();
        } catch (AuthExhaustedException e) {
            log.error("Cycle {}: {}, all resource kinds marked failed", version, e.describe());
            return finish(version, startedAt, List.of(), allFailed(e.describe()), Map.of());
        } catch (MeteringException e) {
            // adapters will retry the login through the session manager
            log.warn("Cycle {}: initial login failed: {}", version, e.describe());
        }

        List<CollectionTask> tasks = new ArrayList<>();
        routes.forEach((kind, generations) ->
                generations.forEach(generation -> tasks.add(new CollectionTask(kind, adapters.get(generation)))));

        runWithinBudget(version, tasks, deadline);

        Map<ResourceKind, List<CollectionTask>> byKind = tasks.stream()
                .collect(Collectors.groupingBy(CollectionTask::getKind,
                        () -> new EnumMap<>(ResourceKind.class), Collectors.toList()));
        boolean authExhausted = tasks.stream().anyMatch(CollectionTask::isAuthExhausted);

        var statuses = new EnumMap<ResourceKind, KindStatus>(ResourceKind.class);
        var errors = new EnumMap<ResourceKind, String>(ResourceKind.class);
        var drops = new EnumMap<ResourceKind, Integer>(ResourceKind.class);
        List<MetricRecord> normalized = new ArrayList<>();

        byKind.forEach((kind, kindTasks) -> {
            boolean clean = kindTasks.stream().allMatch(CollectionTask::isClean);
            boolean fatal = kindTasks.stream().anyMatch(CollectionTask::isFatal);
            kindTasks.stream()
                    .sorted(Comparator.comparing((CollectionTask task) -> task.isFatal() ? 0 : 1))
                    .map(CollectionTask::getError).filter(e -> e != null).findFirst()
                    .ifPresent(e -> errors.put(kind, e.describe()));

            if (fatal || (authExhausted && !clean)) {
                statuses.put(kind, KindStatus.FAILED);
                return;
            }

            List<MetricRecord> kindRecords = new ArrayList<>();
            int dropped = 0;
            for (CollectionTask task : kindTasks) {
                for (AdapterRecord record : task.getRecords()) {
                    try {
                        normalizer.normalize(record).ifPresent(kindRecords::add);
                    } catch (RecordMalformedException e) {
                        dropped++;
                        log.debug("Dropped {} record: {}", kind, e.getMessage());
                        countDrop(kind, e.getReason());
                    }
                }
            }
            if (dropped > 0) {
                log.warn("Cycle {}: dropped {} malformed {} record(s)", version, dropped, kind.getDisplayName());
            }
            drops.put(kind, dropped);

            KindStatus status = clean ? KindStatus.COMPLETE
                    : kindRecords.isEmpty() ? KindStatus.FAILED : KindStatus.PARTIAL;
            statuses.put(kind, status);
            if (status != KindStatus.FAILED) {
                normalized.addAll(kindRecords);
            }
        });

        List<MetricRecord> resolved = resolveClusterNames(normalized);
        SourcePrecedence.Reconciliation reconciliation = precedence.reconcile(resolved);
        if (reconciliation.duplicates() > 0) {
            meterRegistry.counter("metering.records.dropped", "kind", "all", "reason", "duplicate_series")
                    .increment(reconciliation.duplicates());
        }

        Map<String, String> observedNames = cycleClusterNames(reconciliation.records());
        List<MetricRecord> records = new ArrayList<>(reconciliation.records());
        records.addAll(derivedCounts(records, statuses, startedAt));

        var states = new EnumMap<ResourceKind, KindState>(ResourceKind.class);
        statuses.forEach((kind, status) -> {
            int count = (int) records.stream().filter(r -> r.resource().kind() == kind).count();
            states.put(kind, new KindState(status, errors.get(kind), count, drops.getOrDefault(kind, 0)));
        });
        return finish(version, startedAt, records, states, observedNames);
    }

    private void runWithinBudget(long version, List<CollectionTask> tasks, long deadline) {
        long remaining = deadline - System.nanoTime();
        try {
            if (remaining > 0) {
                executor.invokeAll(tasks, remaining, TimeUnit.NANOSECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Cycle {} interrupted, keeping what was collected", version);
            tasks.forEach(task -> task.seal("collection interrupted"));
            return;
        }
        for (CollectionTask task : tasks) {
            task.seal(BUDGET_EXCEEDED);
        }
    }

    /**
     * Cluster names by uuid from this cycle's cluster records; resource-list names win over legacy ones.
     */
    private static Map<String, String> cycleClusterNames(List<MetricRecord> records) {
        var names = new HashMap<String, String>();
        records.stream()
                .filter(r -> r.resource().kind() == ResourceKind.CLUSTER)
                .sorted(Comparator.comparing(r -> r.source() == ApiGeneration.RESOURCE_LIST ? 0 : 1))
                .forEach(r -> r.labels().get("cluster_name")
                        .filter(name -> !name.isBlank() && !name.equals(r.resource().uuid()))
                        .ifPresent(name -> names.putIfAbsent(r.resource().uuid(), name)));
        return names;
    }

    private List<MetricRecord> resolveClusterNames(List<MetricRecord> records) {
        Map<String, String> cycleNames = cycleClusterNames(records);
        List<MetricRecord> resolved = new ArrayList<>(records.size());
        for (MetricRecord record : records) {
            if (!record.labels().contains("cluster_uuid")) {
                resolved.add(record);
                continue;
            }
            String uuid = record.labels().get("cluster_uuid").orElse("");
            String referenced = record.labels().get("cluster_name").orElse("");
            String name = resolveClusterName(uuid, referenced, cycleNames);
            resolved.add(name.equals(referenced) ? record
                    : record.withLabels(record.labels().with("cluster_name", name)));
        }
        return resolved;
    }

    @VisibleForTesting
    String resolveClusterName(String uuid, String referencedName, Map<String, String> cycleNames) {
        if (!uuid.isBlank() && cycleNames.containsKey(uuid)) {
            return cycleNames.get(uuid);
        }
        if (referencedName != null && !referencedName.isBlank()) {
            return referencedName;
        }
        if (!uuid.isBlank()) {
            return lastKnownClusterNames.getOrDefault(uuid, uuid);
        }
        return UNKNOWN_CLUSTER;
    }

    /**
     * VM and host counts per cluster, from kinds that did not fail in this cycle.
     */
    private static List<MetricRecord> derivedCounts(List<MetricRecord> records, Map<ResourceKind, KindStatus> statuses,
                                                    Instant observedAt) {
        List<MetricRecord> derived = new ArrayList<>();
        derived.addAll(countPerCluster(records, statuses, ResourceKind.VM, "nutanix_vm_count", observedAt));
        derived.addAll(countPerCluster(records, statuses, ResourceKind.HOST, "nutanix_host_count", observedAt));
        return derived;
    }

    private static List<MetricRecord> countPerCluster(List<MetricRecord> records,
                                                      Map<ResourceKind, KindStatus> statuses,
                                                      ResourceKind kind, String metricName, Instant observedAt) {
        if (statuses.getOrDefault(kind, KindStatus.FAILED) == KindStatus.FAILED) {
            return List.of();
        }

        // cluster uuid -> member uuids; TreeMap keeps output stable
        var members = new TreeMap<String, Set<String>>();
        var names = new HashMap<String, String>();
        var sources = new HashMap<String, ApiGeneration>();
        for (MetricRecord record : records) {
            if (record.resource().kind() != kind) {
                continue;
            }
            String clusterUuid = record.labels().get("cluster_uuid").orElse("");
            if (clusterUuid.isBlank()) {
                continue;
            }
            members.computeIfAbsent(clusterUuid, k -> new LinkedHashSet<>()).add(record.resource().uuid());
            names.putIfAbsent(clusterUuid, record.labels().get("cluster_name").orElse(clusterUuid));
            sources.putIfAbsent(clusterUuid, record.source());
        }

        List<MetricRecord> counts = new ArrayList<>();
        members.forEach((clusterUuid, uuids) -> counts.add(new MetricRecord(
                new ResourceIdentity(ResourceKind.CLUSTER, clusterUuid, names.get(clusterUuid)),
                metricName,
                uuids.size(),
                MetricUnit.COUNT,
                MetricLabels.of("cluster_name", names.get(clusterUuid), "cluster_uuid", clusterUuid),
                observedAt,
                sources.get(clusterUuid))));
        return counts;
    }

    private Snapshot finish(long version, Instant startedAt, List<MetricRecord> records,
                            Map<ResourceKind, KindState> states, Map<String, String> clusterNames) {
        List<MetricRecord> ordered = new ArrayList<>(records);
        ordered.sort(SNAPSHOT_ORDER);
        var snapshot = new Snapshot(version, startedAt, ordered, states);
        lastKnownClusterNames.putAll(clusterNames);

        String outcome = outcomeOf(states);
        meterRegistry.counter("metering.cycles", "outcome", outcome).increment();

        states.forEach((kind, state) -> {
            if (state.status() == KindStatus.FAILED) {
                log.error("Cycle {}: {} failed: {}", version, kind.getDisplayName(), state.errorMessage().orElse("no records"));
            } else if (state.status() == KindStatus.PARTIAL) {
                log.warn("Cycle {}: {} partial with {} record(s): {}", version, kind.getDisplayName(),
                        state.recordCount(), state.errorMessage().orElse(""));
            }
        });
        log.info("Collection cycle {} finished ({}) in {} ms: {} records, {}", version, outcome,
                Duration.between(startedAt, clock.instant()).toMillis(), ordered.size(), summarize(states));
        return snapshot;
    }

    private static String outcomeOf(Map<ResourceKind, KindState> states) {
        if (states.values().stream().allMatch(s -> s.status() == KindStatus.COMPLETE)) {
            return "complete";
        }
        if (states.values().stream().allMatch(s -> s.status() == KindStatus.FAILED)) {
            return "failed";
        }
        return "partial";
    }

    private static String summarize(Map<ResourceKind, KindState> states) {
        return states.entrySet().stream()
                .map(e -> e.getKey().getDisplayName() + "=" + e.getValue().status() + "/" + e.getValue().recordCount())
                .collect(Collectors.joining(", "));
    }

    private Map<ResourceKind, KindState> allFailed(String error) {
        var states = new EnumMap<ResourceKind, KindState>(ResourceKind.class);
        routes.keySet().forEach(kind -> states.put(kind, KindState.failed(error)));
        return states;
    }

    private void countDrop(ResourceKind kind, String reason) {
        meterRegistry.counter("metering.records.dropped", "kind", kind.getDisplayName(), "reason", reason).increment();
    }

    private static Map<ResourceKind, List<ApiGeneration>> validatedRoutes(
            Map<ResourceKind, List<ApiGeneration>> configured, Map<ApiGeneration, EndpointAdapter> adapters) {
        var routes = new EnumMap<ResourceKind, List<ApiGeneration>>(ResourceKind.class);
        configured.forEach((kind, generations) -> {
            for (ApiGeneration generation : generations) {
                EndpointAdapter adapter = adapters.get(generation);
                if (adapter == null || !adapter.getSupportedKinds().contains(kind)) {
                    throw new IllegalStateException("Route " + kind + " -> " + generation
                            + " has no adapter supporting that kind");
                }
            }
            if (!generations.isEmpty()) {
                routes.put(kind, List.copyOf(new LinkedHashSet<>(generations)));
            }
        });
        return routes;
    }

    /**
     * Lets in-flight adapter calls finish within one read timeout, then interrupts them.
     */
    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Collection workers still busy after {}, interrupting", shutdownGrace);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
