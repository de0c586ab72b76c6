package com.darksite.metering.domain.model;

/**
 * Billable items of the daily export, in per-resource emission order.
 */
public enum MeteredItem {
    VCPU("vCPU", ResourceKind.VM, "nutanix_vm_cpu_count"),
    MEMORY_GB("Memory_GB", ResourceKind.VM, "nutanix_vm_memory_bytes"),
    STORAGE_GB("Storage_GB", ResourceKind.VM, "nutanix_vm_disk_size_bytes"),
    FILES_TIB("Files_TiB", ResourceKind.FILE_SERVER, "nutanix_file_server_used_bytes");

    private final String code;
    private final ResourceKind kind;
    private final String sourceMetric;

    MeteredItem(String code, ResourceKind kind, String sourceMetric) {
        this.code = code;
        this.kind = kind;
        this.sourceMetric = sourceMetric;
    }

    /**
     * Value written to the {@code meteredItem} column.
     */
    public String getCode() {
        return code;
    }

    public ResourceKind getKind() {
        return kind;
    }

    /**
     * Snapshot metric the quantity is derived from.
     */
    public String getSourceMetric() {
        return sourceMetric;
    }
}
