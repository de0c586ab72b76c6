package com.darksite.metering.billing;

import com.darksite.metering.config.MeteringProperties;
import com.darksite.metering.domain.model.ApiGeneration;
import com.darksite.metering.domain.model.BillingRow;
import com.darksite.metering.domain.model.KindState;
import com.darksite.metering.domain.model.KindStatus;
import com.darksite.metering.domain.model.MeteredItem;
import com.darksite.metering.domain.model.MetricLabels;
import com.darksite.metering.domain.model.MetricRecord;
import com.darksite.metering.domain.model.MetricUnit;
import com.darksite.metering.domain.model.ReportingPeriod;
import com.darksite.metering.domain.model.ResourceIdentity;
import com.darksite.metering.domain.model.ResourceKind;
import com.darksite.metering.domain.model.Snapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for BillingProjector.
 *
 * Test strategy:
 * 1. Quantity conversion and rounding per metered item
 * 2. Row ordering and sequence numbers
 * 3. Status handling: failed kinds excluded, missing metrics skip one row
 * 4. Account id selection
 */
class BillingProjectorTest {

    private static final Instant NOW = Instant.parse("2024-05-02T01:00:00Z");
    private static final ReportingPeriod PERIOD =
            new ReportingPeriod(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 2));
    private static final String DEFAULT_ACCOUNT = MeteringProperties.DEFAULT_ACCOUNT_ID;

    private final BillingProjector projector = new BillingProjector();

    private static List<MetricRecord> vm(String uuid, String name, String cluster,
                                         Double vcpus, Double memoryBytes, Double diskBytes) {
        var identity = new ResourceIdentity(ResourceKind.VM, uuid, name);
        var labels = MetricLabels.of("vm_name", name, "vm_uuid", uuid,
                "cluster_uuid", "uuid-" + cluster, "cluster_name", cluster);
        List<MetricRecord> records = new ArrayList<>();
        if (vcpus != null) {
            records.add(new MetricRecord(identity, "nutanix_vm_cpu_count", vcpus, MetricUnit.COUNT, labels,
                    NOW, ApiGeneration.RESOURCE_LIST));
        }
        if (memoryBytes != null) {
            records.add(new MetricRecord(identity, "nutanix_vm_memory_bytes", memoryBytes, MetricUnit.BYTES, labels,
                    NOW, ApiGeneration.RESOURCE_LIST));
        }
        if (diskBytes != null) {
            records.add(new MetricRecord(identity, "nutanix_vm_disk_size_bytes", diskBytes, MetricUnit.BYTES, labels,
                    NOW, ApiGeneration.RESOURCE_LIST));
        }
        return records;
    }

    private static MetricRecord fileServer(String uuid, String name, double usedBytes) {
        return new MetricRecord(new ResourceIdentity(ResourceKind.FILE_SERVER, uuid, name),
                "nutanix_file_server_used_bytes", usedBytes, MetricUnit.BYTES,
                MetricLabels.of("file_server_name", name, "file_server_uuid", uuid),
                NOW, ApiGeneration.FILE_SERVICE);
    }

    private static Snapshot snapshot(List<MetricRecord> records, KindStatus vmStatus, KindStatus fsStatus) {
        var states = new EnumMap<ResourceKind, KindState>(ResourceKind.class);
        states.put(ResourceKind.VM, new KindState(vmStatus, null, 0, 0));
        states.put(ResourceKind.FILE_SERVER, new KindState(fsStatus, null, 0, 0));
        return new Snapshot(7, NOW, records, states);
    }

    private static Snapshot standardSnapshot() {
        List<MetricRecord> records = new ArrayList<>();
        records.addAll(vm("vm-b", "web-02", "prod", 2d, 4_294_967_296d, 21_474_836_480d));
        records.addAll(vm("vm-a", "web-01", "prod", 4d, 8_589_934_592d, 11_811_160_064d));
        records.addAll(vm("vm-c", "db-01", "dev", 8d, 17_179_869_184d, 107_374_182_400d));
        records.add(fileServer("fs-1", "files01", 6_047_313_952_768d));
        return snapshot(records, KindStatus.COMPLETE, KindStatus.COMPLETE);
    }

    @Nested
    @DisplayName("Quantity Tests")
    class QuantityTests {

        @Test
        @DisplayName("Should convert memory bytes to GB with one decimal")
        void shouldConvertMemory() {
            assertThat(BillingProjector.quantity(MeteredItem.MEMORY_GB, 8_589_934_592d))
                    .isEqualTo(new BigDecimal("8.0"));
        }

        @Test
        @DisplayName("Should convert file server bytes to TiB")
        void shouldConvertFiles() {
            assertThat(BillingProjector.quantity(MeteredItem.FILES_TIB, 6_047_313_952_768d))
                    .isEqualTo(new BigDecimal("5.5"));
        }

        @Test
        @DisplayName("Should round half up")
        void shouldRoundHalfUp() {
            // 0.25 GB
            assertThat(BillingProjector.quantity(MeteredItem.STORAGE_GB, 268_435_456d))
                    .isEqualTo(new BigDecimal("0.3"));
        }

        @Test
        @DisplayName("Should report vCPU as a whole number")
        void shouldKeepVcpuWhole() {
            assertThat(BillingProjector.quantity(MeteredItem.VCPU, 4d)).isEqualTo(BigDecimal.valueOf(4));
        }
    }

    @Nested
    @DisplayName("Row Layout Tests")
    class LayoutTests {

        @Test
        @DisplayName("Should order VMs by cluster then name, then file servers, numbering rows from 1")
        void shouldOrderRows() {
            // When
            List<BillingRow> rows = projector.project(standardSnapshot(), PERIOD, DEFAULT_ACCOUNT, "app-7");

            // Then
            assertThat(rows).hasSize(10);
            assertThat(rows).extracting(BillingRow::fqdn).containsExactly(
                    "db-01", "db-01", "db-01",
                    "web-01", "web-01", "web-01",
                    "web-02", "web-02", "web-02",
                    "files01");
            assertThat(rows).extracting(BillingRow::sno).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
            assertThat(rows.subList(0, 3)).extracting(BillingRow::meteredItem)
                    .containsExactly("vCPU", "Memory_GB", "Storage_GB");
        }

        @Test
        @DisplayName("Should fill every column of a VM row")
        void shouldFillColumns() {
            // When
            BillingRow row = projector.project(standardSnapshot(), PERIOD, DEFAULT_ACCOUNT, "app-7").get(4);

            // Then
            assertThat(row.accountId()).isEqualTo("prod");
            assertThat(row.qty()).isEqualTo(new BigDecimal("8.0"));
            assertThat(row.startDate()).isEqualTo(LocalDate.of(2024, 5, 1));
            assertThat(row.endDate()).isEqualTo(LocalDate.of(2024, 5, 2));
            assertThat(row.meteredItem()).isEqualTo("Memory_GB");
            assertThat(row.appid()).isEqualTo("app-7");
            assertThat(row.type()).isEqualTo("VM");
            assertThat(row.description()).isEqualTo("Memory_GB usage for VM web-01");
            assertThat(row.guid()).isEqualTo("vm-a");
        }

        @Test
        @DisplayName("Should produce identical rows for the same snapshot")
        void shouldBeDeterministic() {
            Snapshot snapshot = standardSnapshot();

            assertThat(projector.project(snapshot, PERIOD, DEFAULT_ACCOUNT, "app-7"))
                    .isEqualTo(projector.project(snapshot, PERIOD, DEFAULT_ACCOUNT, "app-7"));
        }
    }

    @Nested
    @DisplayName("Status Handling Tests")
    class StatusTests {

        @Test
        @DisplayName("Should export no VM rows when the VM kind failed")
        void shouldSkipFailedKind() {
            // Given
            List<MetricRecord> records = new ArrayList<>(vm("vm-a", "web-01", "prod", 4d, 8_589_934_592d, null));
            records.add(fileServer("fs-1", "files01", 6_047_313_952_768d));

            // When
            List<BillingRow> rows = projector.project(snapshot(records, KindStatus.FAILED, KindStatus.COMPLETE),
                    PERIOD, DEFAULT_ACCOUNT, "");

            // Then
            assertThat(rows).singleElement().satisfies(row -> {
                assertThat(row.meteredItem()).isEqualTo("Files_TiB");
                assertThat(row.sno()).isEqualTo(1);
            });
        }

        @Test
        @DisplayName("Should skip only the row whose metric is missing in a partial snapshot")
        void shouldSkipMissingMetric() {
            // Given
            Snapshot snapshot = snapshot(vm("vm-a", "web-01", "prod", 4d, 8_589_934_592d, null),
                    KindStatus.PARTIAL, KindStatus.COMPLETE);

            // When
            List<BillingRow> rows = projector.project(snapshot, PERIOD, DEFAULT_ACCOUNT, "");

            // Then
            assertThat(rows).extracting(BillingRow::meteredItem).containsExactly("vCPU", "Memory_GB");
        }

        @Test
        @DisplayName("Should produce no rows from the empty snapshot")
        void shouldProduceNothingFromEmptySnapshot() {
            assertThat(projector.project(Snapshot.empty(), PERIOD, DEFAULT_ACCOUNT, "")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Account Id Tests")
    class AccountTests {

        @Test
        @DisplayName("Should use the cluster name for VMs when no account id is configured")
        void shouldUseClusterName() {
            List<BillingRow> rows = projector.project(standardSnapshot(), PERIOD, DEFAULT_ACCOUNT, "");

            assertThat(rows).extracting(BillingRow::accountId).containsExactly(
                    "dev", "dev", "dev", "prod", "prod", "prod", "prod", "prod", "prod", DEFAULT_ACCOUNT);
        }

        @Test
        @DisplayName("Should use a configured account id on every row")
        void shouldUseConfiguredAccount() {
            List<BillingRow> rows = projector.project(standardSnapshot(), PERIOD, "ACC-42", "");

            assertThat(rows).extracting(BillingRow::accountId).containsOnly("ACC-42");
        }
    }

    @Test
    @DisplayName("Should not confuse file servers with VMs of the same name")
    void shouldKeepKindsApart() {
        List<MetricRecord> records = new ArrayList<>(vm("x-1", "shared", "prod", 1d, null, null));
        records.add(fileServer("x-2", "shared", 1_099_511_627_776d));

        List<BillingRow> rows = projector.project(snapshot(records, KindStatus.COMPLETE, KindStatus.COMPLETE),
                PERIOD, DEFAULT_ACCOUNT, "");

        assertThat(rows).extracting(BillingRow::type).containsExactly("VM", "FileServer");
        assertThat(rows).extracting(BillingRow::guid).containsExactly("x-1", "x-2");
        assertThat(rows.get(1).qty()).isEqualTo(new BigDecimal("1.0"));
    }
}
