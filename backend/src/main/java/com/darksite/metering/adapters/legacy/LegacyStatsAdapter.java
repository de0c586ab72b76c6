package com.darksite.metering.adapters.legacy;

import com.darksite.metering.adapters.AdapterRecord;
import com.darksite.metering.adapters.PaginatedEndpointAdapter;
import com.darksite.metering.adapters.PrismHttpClient;
import com.darksite.metering.adapters.RecordSink;
import com.darksite.metering.adapters.SourceUnit;
import com.darksite.metering.config.MeteringProperties;
import com.darksite.metering.domain.model.ApiGeneration;
import com.darksite.metering.domain.model.ResourceKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adapter for the v2.0 stats API.
 *
 * DATA SOURCES:
 * 1. GET /clusters - hypervisor CPU/memory usage in ppm, storage usage stats, node and core counts
 * 2. GET /storage_containers - container usage and capacity
 *
 * PAGINATION:
 * 1-based {@code page} with {@code count} per page; {@code metadata.total_entities}
 * tells when the listing is exhausted. Stats values arrive as strings.
 */
@Component
@Slf4j
public class LegacyStatsAdapter extends PaginatedEndpointAdapter {

    private static final Map<ResourceKind, String> COLLECTIONS = Map.of(
            ResourceKind.CLUSTER, "/clusters",
            ResourceKind.STORAGE_CONTAINER, "/storage_containers"
    );

    private final int pageSize;

    public LegacyStatsAdapter(PrismHttpClient client, MeteringProperties properties, Clock clock) {
        super(client, clock);
        this.pageSize = properties.getCollection().getLegacyPageSize();
    }

    @Override
    public ApiGeneration getGeneration() {
        return ApiGeneration.LEGACY_STATS;
    }

    @Override
    public Set<ResourceKind> getSupportedKinds() {
        return EnumSet.of(ResourceKind.CLUSTER, ResourceKind.STORAGE_CONTAINER);
    }

    @Override
    protected PageCursor firstPage(ResourceKind kind) {
        return new PageCursor(1, 0);
    }

    @Override
    protected Page fetchPage(ResourceKind kind, PageCursor cursor) {
        String path = COLLECTIONS.get(kind);
        String endpoint = "v2.0" + path;
        JsonNode response = client.get(getGeneration(), endpoint, path,
                Map.of("page", cursor.index(), "count", pageSize));

        List<JsonNode> entities = requireArray(response, "entities", endpoint);
        int total = response.path("metadata").path("total_entities").asInt(-1);
        var following = new PageCursor(cursor.index() + 1, cursor.fetched() + entities.size());
        return Page.of(entities, cursor, following, total, pageSize);
    }

    @Override
    protected void extract(ResourceKind kind, JsonNode entity, Instant observedAt, RecordSink sink) {
        if (kind == ResourceKind.CLUSTER) {
            extractCluster(entity, observedAt, sink);
        } else {
            extractContainer(entity, observedAt, sink);
        }
    }

    private void extractCluster(JsonNode cluster, Instant observedAt, RecordSink sink) {
        String uuid = text(cluster, "uuid") != null ? text(cluster, "uuid") : text(cluster, "cluster_uuid");
        String name = text(cluster, "name");
        var out = new Emitter(ResourceKind.CLUSTER, uuid, name, null, null, observedAt, sink);

        JsonNode stats = cluster.path("stats");
        out.emit("hypervisor_cpu_usage_ppm", scalar(stats.path("hypervisor_cpu_usage_ppm")), SourceUnit.PPM);
        out.emit("hypervisor_memory_usage_ppm", scalar(stats.path("hypervisor_memory_usage_ppm")), SourceUnit.PPM);

        JsonNode usage = cluster.path("usage_stats");
        out.emit("storage.usage_bytes", scalar(usage.path("storage.usage_bytes")), SourceUnit.BYTES);
        out.emit("storage.capacity_bytes", scalar(usage.path("storage.capacity_bytes")), SourceUnit.BYTES);
        out.emit("storage.free_bytes", scalar(usage.path("storage.free_bytes")), SourceUnit.BYTES);

        out.emit("num_nodes", scalar(cluster.path("num_nodes")), SourceUnit.COUNT);
        Object cores = scalar(cluster.path("num_cpu_cores"));
        out.emit("num_cpu_cores", cores != null ? cores : scalar(cluster.path("total_cpu_cores")), SourceUnit.COUNT);
    }

    private void extractContainer(JsonNode container, Instant observedAt, RecordSink sink) {
        var out = new Emitter(ResourceKind.STORAGE_CONTAINER,
                text(container, "storage_container_uuid"), text(container, "name"),
                text(container, "cluster_uuid"), null, observedAt, sink);

        JsonNode usage = container.path("usage_stats");
        out.emit("storage.user_unreserved_usage_bytes",
                scalar(usage.path("storage.user_unreserved_usage_bytes")), SourceUnit.BYTES);
        out.emit("storage.user_capacity_bytes", scalar(usage.path("storage.user_capacity_bytes")), SourceUnit.BYTES);
    }

    private record Emitter(ResourceKind kind, String uuid, String name, String parentUuid, String parentName,
                           Instant observedAt, RecordSink sink) {

        void emit(String field, Object value, SourceUnit unit) {
            sink.accept(new AdapterRecord(ApiGeneration.LEGACY_STATS, kind, uuid, name, field, value, unit,
                    parentUuid, parentName, observedAt));
        }
    }
}
