package com.darksite.metering.billing;

import com.darksite.metering.domain.model.BillingRow;
import com.darksite.metering.domain.model.KindStatus;
import com.darksite.metering.domain.model.MeteredItem;
import com.darksite.metering.domain.model.MetricRecord;
import com.darksite.metering.domain.model.ReportingPeriod;
import com.darksite.metering.domain.model.ResourceIdentity;
import com.darksite.metering.domain.model.ResourceKind;
import com.darksite.metering.domain.model.Snapshot;
import com.darksite.metering.config.MeteringProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the daily billing rows from one snapshot.
 *
 * PROJECTION RULES:
 * 1. Per VM: vCPU (count), Memory_GB and Storage_GB (bytes / 1073741824)
 * 2. Per file server: Files_TiB from used capacity (bytes / 1099511627776)
 * 3. GB and TiB quantities are rounded once, to one decimal, half-up
 * 4. Kinds whose status is Failed contribute no rows
 * 5. A missing metric skips only that item's row, not the resource
 * 6. Order: VMs by cluster name then name, then file servers by name; uuid breaks ties
 *
 * Deterministic: the same snapshot and arguments always give the same rows.
 */
@Component
@Slf4j
public class BillingProjector {

    static final BigDecimal BYTES_PER_GB = BigDecimal.valueOf(1_073_741_824L);
    static final BigDecimal BYTES_PER_TIB = BigDecimal.valueOf(1_099_511_627_776L);
    private static final int QTY_SCALE = 1;

    /**
     * Project billing rows.
     *
     * @param snapshot  the snapshot to bill from
     * @param period    reporting period written on every row
     * @param accountId configured account id; the default value means "use the cluster name" for VMs
     * @param appId     application id written on every row
     */
    public List<BillingRow> project(Snapshot snapshot, ReportingPeriod period, String accountId, String appId) {
        boolean configuredAccount = !MeteringProperties.DEFAULT_ACCOUNT_ID.equals(accountId);
        List<BillingRow> rows = new ArrayList<>();

        if (snapshot.statusOf(ResourceKind.VM) != KindStatus.FAILED) {
            for (Billable vm : billables(snapshot, ResourceKind.VM)) {
                String account = configuredAccount ? accountId : vm.clusterName();
                emit(rows, vm, MeteredItem.VCPU, account, period, appId);
                emit(rows, vm, MeteredItem.MEMORY_GB, account, period, appId);
                emit(rows, vm, MeteredItem.STORAGE_GB, account, period, appId);
            }
        } else {
            log.warn("VM status is FAILED in snapshot {}, no VM rows exported", snapshot.getVersion());
        }

        if (snapshot.statusOf(ResourceKind.FILE_SERVER) != KindStatus.FAILED) {
            for (Billable fileServer : billables(snapshot, ResourceKind.FILE_SERVER)) {
                emit(rows, fileServer, MeteredItem.FILES_TIB, accountId, period, appId);
            }
        } else {
            log.warn("FileServer status is FAILED in snapshot {}, no file server rows exported", snapshot.getVersion());
        }

        log.info("Projected {} billing rows from snapshot {} for {}", rows.size(), snapshot.getVersion(), period);
        return rows;
    }

    /**
     * Billing quantity of a metric value for an item.
     */
    public static BigDecimal quantity(MeteredItem item, double value) {
        return switch (item) {
            case VCPU -> BigDecimal.valueOf(Math.round(value));
            case MEMORY_GB, STORAGE_GB -> toUnit(value, BYTES_PER_GB);
            case FILES_TIB -> toUnit(value, BYTES_PER_TIB);
        };
    }

    private static BigDecimal toUnit(double bytes, BigDecimal bytesPerUnit) {
        return new BigDecimal(bytes).divide(bytesPerUnit, QTY_SCALE, RoundingMode.HALF_UP);
    }

    private static void emit(List<BillingRow> rows, Billable resource, MeteredItem item, String accountId,
                             ReportingPeriod period, String appId) {
        Double value = resource.metrics().get(item.getSourceMetric());
        if (value == null) {
            log.debug("{} {} has no {}, skipping {} row", item.getKind().getDisplayName(),
                    resource.identity().uuid(), item.getSourceMetric(), item.getCode());
            return;
        }
        String name = resource.identity().displayName();
        rows.add(new BillingRow(
                accountId,
                quantity(item, value),
                period.startDate(),
                period.endDate(),
                item.getCode(),
                appId,
                rows.size() + 1,
                name,
                item.getKind().getDisplayName(),
                item.getCode() + " usage for " + item.getKind().getDisplayName() + " " + name,
                resource.identity().uuid()));
    }

    /**
     * Resources of a kind with their metric values, in export order.
     */
    private static List<Billable> billables(Snapshot snapshot, ResourceKind kind) {
        Map<String, ResourceIdentity> identities = new LinkedHashMap<>();
        Map<String, Map<String, Double>> metrics = new HashMap<>();
        Map<String, String> clusterNames = new HashMap<>();

        snapshot.recordsOf(kind).forEach(record -> {
            String uuid = record.resource().uuid();
            identities.putIfAbsent(uuid, record.resource());
            metrics.computeIfAbsent(uuid, k -> new HashMap<>()).put(record.metricName(), record.value());
            clusterNames.putIfAbsent(uuid, clusterNameOf(record));
        });

        return identities.values().stream()
                .map(identity -> new Billable(identity, clusterNames.get(identity.uuid()),
                        metrics.get(identity.uuid())))
                .sorted(Comparator.comparing(Billable::clusterName)
                        .thenComparing(b -> b.identity().displayName())
                        .thenComparing(b -> b.identity().uuid()))
                .toList();
    }

    private static String clusterNameOf(MetricRecord record) {
        return record.labels().get("cluster_name").orElse("");
    }

    private record Billable(ResourceIdentity identity, String clusterName, Map<String, Double> metrics) {}
}
