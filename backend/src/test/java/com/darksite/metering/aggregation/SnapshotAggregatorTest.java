package com.darksite.metering.aggregation;

import com.darksite.metering.adapters.AdapterRecord;
import com.darksite.metering.adapters.EndpointAdapter;
import com.darksite.metering.adapters.ErrorCategory;
import com.darksite.metering.adapters.MeteringException;
import com.darksite.metering.adapters.RecordSink;
import com.darksite.metering.adapters.SourceUnit;
import com.darksite.metering.config.MeteringProperties;
import com.darksite.metering.domain.model.ApiGeneration;
import com.darksite.metering.domain.model.KindStatus;
import com.darksite.metering.domain.model.MetricRecord;
import com.darksite.metering.domain.model.ResourceKind;
import com.darksite.metering.domain.model.Snapshot;
import com.darksite.metering.normalization.MetricNormalizer;
import com.darksite.metering.normalization.SourcePrecedence;
import com.darksite.metering.session.AuthExhaustedException;
import com.darksite.metering.session.SessionManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SnapshotAggregator.
 *
 * Test strategy:
 * 1. Per-kind status derivation: Complete, Partial and Failed
 * 2. Failure isolation between resource kinds
 * 3. Cluster name resolution when the cluster kind fails
 * 4. Cycle budget and authentication exhaustion
 * 5. Snapshot invariants: unique series, derived counts
 */
@ExtendWith(MockitoExtension.class)
class SnapshotAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private SessionManager sessionManager;

    private MeteringProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private StubAdapter legacy;
    private StubAdapter resourceList;
    private StubAdapter files;
    private SnapshotAggregator aggregator;

    @BeforeEach
    void setUp() {
        properties = new MeteringProperties();
        meterRegistry = new SimpleMeterRegistry();
        legacy = new StubAdapter(ApiGeneration.LEGACY_STATS, ResourceKind.CLUSTER, ResourceKind.STORAGE_CONTAINER);
        resourceList = new StubAdapter(ApiGeneration.RESOURCE_LIST, ResourceKind.CLUSTER, ResourceKind.HOST, ResourceKind.VM);
        files = new StubAdapter(ApiGeneration.FILE_SERVICE, ResourceKind.FILE_SERVER);
        healthyCluster();
    }

    @AfterEach
    void tearDown() {
        if (aggregator != null) {
            aggregator.shutdown();
        }
    }

    private SnapshotAggregator aggregator() {
        var adapters = new EnumMap<ApiGeneration, EndpointAdapter>(ApiGeneration.class);
        adapters.put(ApiGeneration.LEGACY_STATS, legacy);
        adapters.put(ApiGeneration.RESOURCE_LIST, resourceList);
        adapters.put(ApiGeneration.FILE_SERVICE, files);
        aggregator = new SnapshotAggregator(adapters, sessionManager, new MetricNormalizer(),
                new SourcePrecedence(properties), meterRegistry, Clock.fixed(NOW, ZoneOffset.UTC), properties);
        return aggregator;
    }

    private static AdapterRecord record(ApiGeneration source, ResourceKind kind, String uuid, String name,
                                        String field, Object value, SourceUnit unit,
                                        String parentUuid, String parentName) {
        return new AdapterRecord(source, kind, uuid, name, field, value, unit, parentUuid, parentName, NOW);
    }

    private static AdapterRecord vmRecord(String uuid, String field, Object value, SourceUnit unit, String clusterName) {
        return record(ApiGeneration.RESOURCE_LIST, ResourceKind.VM, uuid, "vm-" + uuid, field, value, unit,
                "cl-1", clusterName);
    }

    private void healthyCluster() {
        legacy.on(ResourceKind.CLUSTER, sink -> sink.acceptAll(List.of(
                record(ApiGeneration.LEGACY_STATS, ResourceKind.CLUSTER, "cl-1", null, "num_nodes", 4,
                        SourceUnit.COUNT, null, null))));
        resourceList.on(ResourceKind.CLUSTER, sink -> sink.acceptAll(List.of(
                record(ApiGeneration.RESOURCE_LIST, ResourceKind.CLUSTER, "cl-1", "prod", "info", 1,
                        SourceUnit.COUNT, null, null),
                record(ApiGeneration.RESOURCE_LIST, ResourceKind.CLUSTER, "cl-1", "prod", "num_nodes", 3,
                        SourceUnit.COUNT, null, null))));
        resourceList.on(ResourceKind.VM, sink -> sink.acceptAll(List.of(
                vmRecord("1", "num_vcpus", 4L, SourceUnit.COUNT, "prod"),
                vmRecord("1", "memory_size_mib", 8192, SourceUnit.MIB, "prod"),
                vmRecord("2", "num_vcpus", 2L, SourceUnit.COUNT, "prod"))));
        resourceList.on(ResourceKind.HOST, sink -> sink.acceptAll(List.of(
                record(ApiGeneration.RESOURCE_LIST, ResourceKind.HOST, "h-1", "node-a", "num_cpu_sockets", 2,
                        SourceUnit.COUNT, "cl-1", "prod"))));
        files.on(ResourceKind.FILE_SERVER, sink -> sink.acceptAll(List.of(
                record(ApiGeneration.FILE_SERVICE, ResourceKind.FILE_SERVER, "fs-1", "files01",
                        "usedCapacityBytes", 6_047_313_952_768L, SourceUnit.BYTES, null, null))));
    }

    private static List<MetricRecord> metric(Snapshot snapshot, String name) {
        return snapshot.getRecords().stream().filter(r -> r.metricName().equals(name)).toList();
    }

    @Nested
    @DisplayName("Status Derivation Tests")
    class StatusTests {

        @Test
        @DisplayName("Should mark every kind complete when all routes drain cleanly")
        void shouldBeCompleteWhenAllSucceed() {
            // When
            Snapshot snapshot = aggregator().collect();

            // Then
            assertThat(snapshot.getVersion()).isEqualTo(1);
            assertThat(snapshot.getCollectedAt()).isEqualTo(NOW);
            assertThat(snapshot.getKindStates().values())
                    .allSatisfy(state -> assertThat(state.status()).isEqualTo(KindStatus.COMPLETE));
            assertThat(metric(snapshot, "nutanix_vm_cpu_count")).hasSize(2);
            assertThat(meterRegistry.counter("metering.cycles", "outcome", "complete").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should isolate a failed file service from the other kinds")
        void shouldIsolateFileServiceFailure() {
            // Given
            files.on(ResourceKind.FILE_SERVER, sink -> {
                throw new MeteringException(ErrorCategory.PERMANENT, "HTTP 400 from files");
            });

            // When
            Snapshot snapshot = aggregator().collect();

            // Then
            assertThat(snapshot.statusOf(ResourceKind.FILE_SERVER)).isEqualTo(KindStatus.FAILED);
            assertThat(snapshot.stateOf(ResourceKind.FILE_SERVER).orElseThrow().errorMessage())
                    .hasValueSatisfying(error -> assertThat(error).contains("HTTP 400"));
            assertThat(snapshot.statusOf(ResourceKind.VM)).isEqualTo(KindStatus.COMPLETE);
            assertThat(snapshot.statusOf(ResourceKind.HOST)).isEqualTo(KindStatus.COMPLETE);
            assertThat(snapshot.statusOf(ResourceKind.CLUSTER)).isEqualTo(KindStatus.COMPLETE);
            assertThat(snapshot.recordsOf(ResourceKind.FILE_SERVER)).isEmpty();
            assertThat(snapshot.recordsOf(ResourceKind.VM)).isNotEmpty();
        }

        @Test
        @DisplayName("Should mark a kind partial and keep only the pages drained before the failure")
        void shouldKeepPagesBeforeFailure() {
            // Given
            resourceList.on(ResourceKind.VM, sink -> {
                sink.acceptAll(List.of(vmRecord("1", "num_vcpus", 4L, SourceUnit.COUNT, "prod")));
                sink.acceptAll(List.of(vmRecord("2", "num_vcpus", 2L, SourceUnit.COUNT, "prod")));
                throw new MeteringException(ErrorCategory.TRANSIENT, "HTTP 503 from v3/vms/list");
            });

            // When
            Snapshot snapshot = aggregator().collect();

            // Then
            assertThat(snapshot.statusOf(ResourceKind.VM)).isEqualTo(KindStatus.PARTIAL);
            assertThat(metric(snapshot, "nutanix_vm_cpu_count"))
                    .extracting(r -> r.resource().uuid())
                    .containsExactly("1", "2");
        }

        @Test
        @DisplayName("Should fail a kind and discard its pages when a request is rejected mid-drain")
        void shouldFailKindOnPermanentErrorAfterFirstPage() {
            // Given
            resourceList.on(ResourceKind.VM, sink -> {
                sink.acceptAll(List.of(vmRecord("1", "num_vcpus", 4L, SourceUnit.COUNT, "prod")));
                throw new MeteringException(ErrorCategory.PERMANENT, "HTTP 400 from v3/vms/list", null, 400);
            });

            // When
            Snapshot snapshot = aggregator().collect();

            // Then
            assertThat(snapshot.statusOf(ResourceKind.VM)).isEqualTo(KindStatus.FAILED);
            assertThat(snapshot.recordsOf(ResourceKind.VM)).isEmpty();
            assertThat(snapshot.stateOf(ResourceKind.VM).orElseThrow().errorMessage())
                    .hasValueSatisfying(error -> assertThat(error).contains("HTTP 400"));
            assertThat(metric(snapshot, "nutanix_vm_count")).isEmpty();
            assertThat(snapshot.statusOf(ResourceKind.HOST)).isEqualTo(KindStatus.COMPLETE);
        }

        @Test
        @DisplayName("Should fail a kind and discard its pages when the credential is rejected mid-drain")
        void shouldFailKindOnAuthErrorAfterFirstPage() {
            // Given
            resourceList.on(ResourceKind.VM, sink -> {
                sink.acceptAll(List.of(vmRecord("1", "num_vcpus", 4L, SourceUnit.COUNT, "prod")));
                throw new MeteringException(ErrorCategory.AUTH, "HTTP 401 from v3/vms/list", null, 401);
            });

            // When
            Snapshot snapshot = aggregator().collect();

            // Then
            assertThat(snapshot.statusOf(ResourceKind.VM)).isEqualTo(KindStatus.FAILED);
            assertThat(snapshot.recordsOf(ResourceKind.VM)).isEmpty();
            assertThat(snapshot.statusOf(ResourceKind.FILE_SERVER)).isEqualTo(KindStatus.COMPLETE);
        }

        @Test
        @DisplayName("Should fail a kind when one of its routes is rejected even if another succeeds")
        void shouldFailKindWhenOneRouteIsRejected() {
            // Given
            legacy.on(ResourceKind.CLUSTER, sink -> {
                throw new MeteringException(ErrorCategory.PERMANENT, "HTTP 404 from v2.0/clusters", null, 404);
            });

            // When
            Snapshot snapshot = aggregator().collect();

            // Then
            assertThat(snapshot.statusOf(ResourceKind.CLUSTER)).isEqualTo(KindStatus.FAILED);
            assertThat(snapshot.recordsOf(ResourceKind.CLUSTER)).isEmpty();
            assertThat(metric(snapshot, "nutanix_vm_cpu_count"))
                    .allSatisfy(r -> assertThat(r.labels().get("cluster_name")).contains("prod"));
        }

        @Test
        @DisplayName("Should count malformed records without failing the batch")
        void shouldCountMalformedRecords() {
            // Given
            resourceList.on(ResourceKind.VM, sink -> sink.acceptAll(List.of(
                    vmRecord("1", "num_vcpus", 4L, SourceUnit.COUNT, "prod"),
                    vmRecord(null, "num_vcpus", 4L, SourceUnit.COUNT, "prod"),
                    vmRecord("3", "power_state", "SUSPENDED", SourceUnit.POWER_STATE, "prod"))));

            // When
            Snapshot snapshot = aggregator().collect();

            // Then
            var state = snapshot.stateOf(ResourceKind.VM).orElseThrow();
            assertThat(state.status()).isEqualTo(KindStatus.COMPLETE);
            assertThat(state.droppedRecords()).isEqualTo(2);
            assertThat(meterRegistry.counter("metering.records.dropped", "kind", "VM", "reason", "missing_uuid")
                    .count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should fail every kind without polling when authentication is exhausted")
        void shouldFailAllKindsWhenAuthExhausted() {
            // Given
            when(sessionManager.acquire()).thenThrow(new AuthExhaustedException(3, null));

            // When
            Snapshot snapshot = aggregator().collect();

            // Then
            assertThat(snapshot.getRecords()).isEmpty();
            assertThat(snapshot.getKindStates()).hasSize(5);
            assertThat(snapshot.getKindStates().values())
                    .allSatisfy(state -> assertThat(state.status()).isEqualTo(KindStatus.FAILED));
            assertThat(resourceList.calls).isZero();
            verify(sessionManager).beginCycle();
            verify(sessionManager).endCycle();
        }

        @Test
        @DisplayName("Should fail a kind still draining when the cycle budget runs out")
        void shouldFailKindOverBudget() {
            // Given
            properties.getCollection().setCycleBudget(Duration.ofMillis(300));
            files.on(ResourceKind.FILE_SERVER, sink -> {
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new MeteringException(ErrorCategory.TRANSIENT, "interrupted");
                }
                sink.acceptAll(List.of(record(ApiGeneration.FILE_SERVICE, ResourceKind.FILE_SERVER, "fs-late",
                        "late", "usedCapacityBytes", 1, SourceUnit.BYTES, null, null)));
            });

            // When
            Snapshot snapshot = aggregator().collect();

            // Then
            assertThat(snapshot.statusOf(ResourceKind.FILE_SERVER)).isEqualTo(KindStatus.FAILED);
            assertThat(snapshot.stateOf(ResourceKind.FILE_SERVER).orElseThrow().errorMessage()).isPresent();
            assertThat(snapshot.recordsOf(ResourceKind.FILE_SERVER)).isEmpty();
            assertThat(snapshot.statusOf(ResourceKind.VM)).isEqualTo(KindStatus.COMPLETE);
        }
    }

    @Nested
    @DisplayName("Cross Reference Tests")
    class CrossReferenceTests {

        @Test
        @DisplayName("Should keep VMs with the last known cluster name when the cluster kind fails")
        void shouldKeepVmsWhenClusterFails() {
            // Given
            SnapshotAggregator aggregator = aggregator();
            aggregator.collect();
            Consumer<RecordSink> failing = sink -> {
                throw new MeteringException(ErrorCategory.PERMANENT, "HTTP 400");
            };
            legacy.on(ResourceKind.CLUSTER, failing);
            resourceList.on(ResourceKind.CLUSTER, failing);
            resourceList.on(ResourceKind.VM, sink -> sink.acceptAll(List.of(
                    vmRecord("1", "num_vcpus", 4L, SourceUnit.COUNT, null))));

            // When
            Snapshot snapshot = aggregator.collect();

            // Then
            assertThat(snapshot.statusOf(ResourceKind.CLUSTER)).isEqualTo(KindStatus.FAILED);
            assertThat(metric(snapshot, "nutanix_vm_cpu_count")).singleElement()
                    .satisfies(r -> assertThat(r.labels().get("cluster_name")).contains("prod"));
        }

        @Test
        @DisplayName("Should fall back to the cluster uuid when no name was ever seen")
        void shouldFallBackToUuid() {
            // Given
            Consumer<RecordSink> failing = sink -> {
                throw new MeteringException(ErrorCategory.PERMANENT, "HTTP 400");
            };
            legacy.on(ResourceKind.CLUSTER, failing);
            resourceList.on(ResourceKind.CLUSTER, failing);
            resourceList.on(ResourceKind.VM, sink -> sink.acceptAll(List.of(
                    vmRecord("1", "num_vcpus", 4L, SourceUnit.COUNT, null))));

            // When
            Snapshot snapshot = aggregator().collect();

            // Then
            assertThat(metric(snapshot, "nutanix_vm_cpu_count")).singleElement()
                    .satisfies(r -> assertThat(r.labels().get("cluster_name")).contains("cl-1"));
        }

        @Test
        @DisplayName("Should name clusters from the resource list when the legacy API omits names")
        void shouldResolveClusterNames() {
            Snapshot snapshot = aggregator().collect();

            assertThat(metric(snapshot, "nutanix_cluster_node_count")).singleElement()
                    .satisfies(r -> assertThat(r.labels().get("cluster_name")).contains("prod"));
        }

        @Test
        @DisplayName("Should prefer the unknown marker when a VM references no cluster at all")
        void shouldMarkUnknownCluster() {
            assertThat(aggregator().resolveClusterName("", null, Map.of()))
                    .isEqualTo(SnapshotAggregator.UNKNOWN_CLUSTER);
        }
    }

    @Nested
    @DisplayName("Snapshot Invariant Tests")
    class InvariantTests {

        @Test
        @DisplayName("Should keep one series per metric and label set, legacy node count winning")
        void shouldKeepSeriesUnique() {
            // When
            Snapshot snapshot = aggregator().collect();

            // Then
            Set<MetricRecord.SeriesKey> keys = new HashSet<>();
            snapshot.getRecords().forEach(r -> assertThat(keys.add(r.seriesKey())).isTrue());
            assertThat(metric(snapshot, "nutanix_cluster_node_count")).singleElement()
                    .satisfies(r -> assertThat(r.value()).isEqualTo(4.0));
        }

        @Test
        @DisplayName("Should derive VM and host counts per cluster")
        void shouldDeriveCounts() {
            Snapshot snapshot = aggregator().collect();

            assertThat(metric(snapshot, "nutanix_vm_count")).singleElement()
                    .satisfies(r -> assertThat(r.value()).isEqualTo(2.0));
            assertThat(metric(snapshot, "nutanix_host_count")).singleElement()
                    .satisfies(r -> assertThat(r.value()).isEqualTo(1.0));
        }

        @Test
        @DisplayName("Should not derive counts from a failed kind")
        void shouldNotDeriveFromFailedKind() {
            resourceList.on(ResourceKind.HOST, sink -> {
                throw new MeteringException(ErrorCategory.PERMANENT, "HTTP 400");
            });

            Snapshot snapshot = aggregator().collect();

            assertThat(metric(snapshot, "nutanix_host_count")).isEmpty();
        }

        @Test
        @DisplayName("Should number snapshots with increasing versions")
        void shouldIncrementVersions() {
            SnapshotAggregator aggregator = aggregator();

            assertThat(aggregator.collect().getVersion()).isEqualTo(1);
            assertThat(aggregator.collect().getVersion()).isEqualTo(2);
        }
    }

    /**
     * Adapter whose behaviour per kind is set by the test.
     */
    static final class StubAdapter implements EndpointAdapter {

        private final ApiGeneration generation;
        private final Set<ResourceKind> kinds;
        private final Map<ResourceKind, Consumer<RecordSink>> behaviour = new EnumMap<>(ResourceKind.class);
        volatile int calls;

        StubAdapter(ApiGeneration generation, ResourceKind... kinds) {
            this.generation = generation;
            this.kinds = Set.of(kinds);
        }

        void on(ResourceKind kind, Consumer<RecordSink> action) {
            behaviour.put(kind, action);
        }

        @Override
        public ApiGeneration getGeneration() {
            return generation;
        }

        @Override
        public Set<ResourceKind> getSupportedKinds() {
            return kinds;
        }

        @Override
        public void fetch(ResourceKind kind, RecordSink sink) {
            calls++;
            behaviour.getOrDefault(kind, s -> { }).accept(sink);
        }
    }
}
