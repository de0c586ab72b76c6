package com.darksite.metering.normalization;

import com.darksite.metering.adapters.AdapterRecord;
import com.darksite.metering.adapters.SourceUnit;
import com.darksite.metering.domain.model.MetricLabels;
import com.darksite.metering.domain.model.MetricRecord;
import com.darksite.metering.domain.model.MetricUnit;
import com.darksite.metering.domain.model.ResourceIdentity;
import com.darksite.metering.domain.model.ResourceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps adapter-local records onto the canonical metric model.
 *
 * NORMALIZATION PRINCIPLES:
 * 1. Names: every (kind, adapter field) pair maps to one exposition metric name
 * 2. Units: ppm becomes percent clamped to [0,100], MiB becomes bytes; bytes stay raw bytes
 * 3. Power state: ON is 1, OFF is 0, anything else is dropped with a warning
 * 4. Missing values (absent, or the control plane's -1 sentinel) are omitted, never zero
 * 5. Labels: fixed per kind, resource name and uuid first, owning cluster last
 *
 * Pure and deterministic: no network access and no state between calls.
 * Byte to GB/TiB conversion is left to billing so values are rounded only once.
 */
@Component
@Slf4j
public class MetricNormalizer {

    static final double PPM_PER_PERCENT = 10_000d;
    static final double BYTES_PER_MIB = 1_048_576d;
    static final double MISSING_SENTINEL = -1d;

    private static final Map<ResourceKind, Map<String, Mapping>> MAPPINGS = buildMappings();

    /**
     * Normalize one adapter record.
     *
     * @return the canonical record, or empty when the value is absent
     * @throws RecordMalformedException when the record cannot be identified or its value parsed
     */
    public Optional<MetricRecord> normalize(AdapterRecord record) {
        if (record.uuid() == null || record.uuid().isBlank()) {
            throw new RecordMalformedException("missing_uuid",
                    record.kind() + " record from " + record.source() + " has no uuid");
        }

        Mapping mapping = MAPPINGS.getOrDefault(record.kind(), Map.of()).get(record.field());
        if (mapping == null) {
            throw new RecordMalformedException("unmapped_field",
                    "No metric for " + record.kind() + " field '" + record.field() + "'");
        }

        if (record.rawValue() == null) {
            return Optional.empty();
        }

        Double value = convert(record, mapping);
        if (value == null) {
            return Optional.empty();
        }

        var resource = new ResourceIdentity(record.kind(), record.uuid(), record.name());
        return Optional.of(new MetricRecord(resource, mapping.metricName(), value, mapping.unit(),
                labelsFor(record, resource), record.observedAt(), record.source()));
    }

    /**
     * Metric name a (kind, field) pair normalizes to, if any.
     */
    public Optional<String> metricNameFor(ResourceKind kind, String field) {
        return Optional.ofNullable(MAPPINGS.getOrDefault(kind, Map.of()).get(field)).map(Mapping::metricName);
    }

    private Double convert(AdapterRecord record, Mapping mapping) {
        if (record.unit() == SourceUnit.POWER_STATE) {
            return powerState(record);
        }

        double raw = parse(record);
        if (raw == MISSING_SENTINEL) {
            return null;
        }

        return switch (record.unit()) {
            case PPM -> clampPercent(raw / PPM_PER_PERCENT);
            case PERCENT -> clampPercent(raw);
            case MIB -> requireNonNegative(record, raw) * BYTES_PER_MIB;
            case BYTES, COUNT -> requireNonNegative(record, raw);
            case POWER_STATE -> throw new IllegalStateException("handled above");
        };
    }

    private static double powerState(AdapterRecord record) {
        String state = String.valueOf(record.rawValue()).trim().toUpperCase(Locale.ROOT);
        return switch (state) {
            case "ON" -> 1d;
            case "OFF" -> 0d;
            default -> {
                log.warn("Dropping unknown power state '{}' for {} {}", record.rawValue(), record.kind(), record.uuid());
                throw new RecordMalformedException("unknown_power_state",
                        "Unknown power state '" + record.rawValue() + "' for " + record.uuid());
            }
        };
    }

    private static double parse(AdapterRecord record) {
        double value;
        if (record.rawValue() instanceof Number number) {
            value = number.doubleValue();
        } else {
            try {
                value = Double.parseDouble(record.rawValue().toString().trim());
            } catch (NumberFormatException e) {
                throw new RecordMalformedException("unparseable_value",
                        "Field '" + record.field() + "' of " + record.uuid() + " is not numeric: " + record.rawValue(), e);
            }
        }
        if (!Double.isFinite(value)) {
            throw new RecordMalformedException("unparseable_value",
                    "Field '" + record.field() + "' of " + record.uuid() + " is not finite");
        }
        return value;
    }

    private static double requireNonNegative(AdapterRecord record, double value) {
        if (value < 0) {
            throw new RecordMalformedException("negative_value",
                    "Field '" + record.field() + "' of " + record.uuid() + " is negative: " + value);
        }
        return value;
    }

    static double clampPercent(double percent) {
        return Math.max(0d, Math.min(100d, percent));
    }

    /**
     * Cluster names start from the record's own reference; the aggregator resolves blanks afterwards.
     */
    private static MetricLabels labelsFor(AdapterRecord record, ResourceIdentity resource) {
        String name = resource.displayName();
        return switch (record.kind()) {
            case CLUSTER -> MetricLabels.of(
                    "cluster_name", record.name(),
                    "cluster_uuid", record.uuid());
            case HOST -> MetricLabels.of(
                    "host_name", name,
                    "host_uuid", record.uuid(),
                    "cluster_uuid", record.parentUuid(),
                    "cluster_name", record.parentName());
            case VM -> MetricLabels.of(
                    "vm_name", name,
                    "vm_uuid", record.uuid(),
                    "cluster_uuid", record.parentUuid(),
                    "cluster_name", record.parentName());
            case STORAGE_CONTAINER -> MetricLabels.of(
                    "container_name", name,
                    "container_uuid", record.uuid());
            case FILE_SERVER -> MetricLabels.of(
                    "file_server_name", name,
                    "file_server_uuid", record.uuid());
        };
    }

    private static Map<ResourceKind, Map<String, Mapping>> buildMappings() {
        var mappings = new EnumMap<ResourceKind, Map<String, Mapping>>(ResourceKind.class);

        mappings.put(ResourceKind.CLUSTER, Map.ofEntries(
                Map.entry("info", new Mapping("nutanix_cluster_info", MetricUnit.COUNT)),
                Map.entry("hypervisor_cpu_usage_ppm", new Mapping("nutanix_cluster_cpu_usage_percent", MetricUnit.PERCENT)),
                Map.entry("hypervisor_memory_usage_ppm", new Mapping("nutanix_cluster_memory_usage_percent", MetricUnit.PERCENT)),
                Map.entry("storage.usage_bytes", new Mapping("nutanix_cluster_storage_usage_bytes", MetricUnit.BYTES)),
                Map.entry("storage.capacity_bytes", new Mapping("nutanix_cluster_storage_capacity_bytes", MetricUnit.BYTES)),
                Map.entry("storage.free_bytes", new Mapping("nutanix_cluster_storage_free_bytes", MetricUnit.BYTES)),
                Map.entry("num_nodes", new Mapping("nutanix_cluster_node_count", MetricUnit.COUNT)),
                Map.entry("num_cpu_cores", new Mapping("nutanix_cluster_physical_cpu_cores", MetricUnit.COUNT))
        ));

        mappings.put(ResourceKind.HOST, Map.of(
                "hypervisor.cpu_usage_ppm", new Mapping("nutanix_host_cpu_usage_percent", MetricUnit.PERCENT),
                "hypervisor.memory_usage_ppm", new Mapping("nutanix_host_memory_usage_percent", MetricUnit.PERCENT),
                "hypervisor.num_vms", new Mapping("nutanix_host_num_vms", MetricUnit.COUNT),
                "num_cpu_cores", new Mapping("nutanix_host_physical_cpu_cores", MetricUnit.COUNT),
                "num_cpu_sockets", new Mapping("nutanix_host_cpu_sockets", MetricUnit.COUNT)
        ));

        mappings.put(ResourceKind.VM, Map.of(
                "power_state", new Mapping("nutanix_vm_power_state", MetricUnit.COUNT),
                "num_vcpus", new Mapping("nutanix_vm_cpu_count", MetricUnit.COUNT),
                "memory_size_mib", new Mapping("nutanix_vm_memory_bytes", MetricUnit.BYTES),
                "disk_size_bytes", new Mapping("nutanix_vm_disk_size_bytes", MetricUnit.BYTES)
        ));

        mappings.put(ResourceKind.STORAGE_CONTAINER, Map.of(
                "storage.user_unreserved_usage_bytes", new Mapping("nutanix_storage_container_usage_bytes", MetricUnit.BYTES),
                "storage.user_capacity_bytes", new Mapping("nutanix_storage_container_capacity_bytes", MetricUnit.BYTES)
        ));

        mappings.put(ResourceKind.FILE_SERVER, Map.of(
                "storageCapacityBytes", new Mapping("nutanix_file_server_capacity_bytes", MetricUnit.BYTES),
                "usedCapacityBytes", new Mapping("nutanix_file_server_used_bytes", MetricUnit.BYTES),
                "availableCapacityBytes", new Mapping("nutanix_file_server_available_bytes", MetricUnit.BYTES),
                "numberOfFiles", new Mapping("nutanix_file_server_files_count", MetricUnit.COUNT),
                "numberOfConnections", new Mapping("nutanix_file_server_connections", MetricUnit.COUNT)
        ));

        return mappings;
    }

    private record Mapping(String metricName, MetricUnit unit) {}
}
