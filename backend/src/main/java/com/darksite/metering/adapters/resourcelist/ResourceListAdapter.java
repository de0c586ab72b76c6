package com.darksite.metering.adapters.resourcelist;

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
 * Adapter for the v3 resource-list API.
 *
 * DATA SOURCES:
 * 1. POST /clusters/list - cluster identity and node list
 * 2. POST /hosts/list - host CPU/memory usage, VM count, socket and core counts
 * 3. POST /vms/list - power state, vCPU, memory and disk sizes
 *
 * PAGINATION:
 * Offset based: the request body carries {@code kind}, {@code length} and
 * {@code offset}; {@code metadata.total_matches} bounds the listing.
 */
@Component
@Slf4j
public class ResourceListAdapter extends PaginatedEndpointAdapter {

    private static final long MIB = 1024L * 1024L;

    private static final Map<ResourceKind, String> KIND_NAMES = Map.of(
            ResourceKind.CLUSTER, "cluster",
            ResourceKind.HOST, "host",
            ResourceKind.VM, "vm"
    );

    private final int pageSize;

    public ResourceListAdapter(PrismHttpClient client, MeteringProperties properties, Clock clock) {
        super(client, clock);
        this.pageSize = properties.getCollection().getResourceListPageSize();
    }

    @Override
    public ApiGeneration getGeneration() {
        return ApiGeneration.RESOURCE_LIST;
    }

    @Override
    public Set<ResourceKind> getSupportedKinds() {
        return EnumSet.of(ResourceKind.CLUSTER, ResourceKind.HOST, ResourceKind.VM);
    }

    @Override
    protected PageCursor firstPage(ResourceKind kind) {
        return new PageCursor(0, 0);
    }

    @Override
    protected Page fetchPage(ResourceKind kind, PageCursor cursor) {
        String kindName = KIND_NAMES.get(kind);
        String path = "/" + kindName + "s/list";
        String endpoint = "v3" + path;
        JsonNode response = client.post(getGeneration(), endpoint, path,
                Map.of("kind", kindName, "length", pageSize, "offset", cursor.index()));

        List<JsonNode> entities = requireArray(response, "entities", endpoint);
        int total = response.path("metadata").path("total_matches").asInt(-1);
        var following = new PageCursor(cursor.index() + entities.size(), cursor.fetched() + entities.size());
        return Page.of(entities, cursor, following, total, pageSize);
    }

    @Override
    protected void extract(ResourceKind kind, JsonNode entity, Instant observedAt, RecordSink sink) {
        switch (kind) {
            case CLUSTER -> extractCluster(entity, observedAt, sink);
            case HOST -> extractHost(entity, observedAt, sink);
            case VM -> extractVm(entity, observedAt, sink);
            default -> throw new IllegalArgumentException("Unsupported kind " + kind);
        }
    }

    private void extractCluster(JsonNode cluster, Instant observedAt, RecordSink sink) {
        var out = emitter(ResourceKind.CLUSTER, cluster, null, observedAt, sink);
        out.emit("info", 1, SourceUnit.COUNT);

        JsonNode servers = cluster.path("status").path("resources").path("nodes").path("hypervisor_server_list");
        if (servers.isArray()) {
            out.emit("num_nodes", servers.size(), SourceUnit.COUNT);
        }
    }

    private void extractHost(JsonNode host, Instant observedAt, RecordSink sink) {
        JsonNode status = host.path("status");
        var out = emitter(ResourceKind.HOST, host, status.path("cluster_reference"), observedAt, sink);

        JsonNode resources = status.path("resources");
        JsonNode hypervisor = resources.path("hypervisor");
        out.emit("hypervisor.cpu_usage_ppm", scalar(hypervisor.path("cpu_usage_ppm")), SourceUnit.PPM);
        out.emit("hypervisor.memory_usage_ppm", scalar(hypervisor.path("memory_usage_ppm")), SourceUnit.PPM);
        out.emit("hypervisor.num_vms", scalar(hypervisor.path("num_vms")), SourceUnit.COUNT);
        out.emit("num_cpu_cores", scalar(resources.path("num_cpu_cores")), SourceUnit.COUNT);
        out.emit("num_cpu_sockets", scalar(resources.path("num_cpu_sockets")), SourceUnit.COUNT);
    }

    private void extractVm(JsonNode vm, Instant observedAt, RecordSink sink) {
        JsonNode reference = vm.path("spec").path("cluster_reference");
        if (!reference.isObject()) {
            reference = vm.path("status").path("cluster_reference");
        }
        var out = emitter(ResourceKind.VM, vm, reference, observedAt, sink);

        JsonNode resources = vm.path("spec").path("resources");
        out.emit("power_state", scalar(vm.path("status").path("resources").path("power_state")),
                SourceUnit.POWER_STATE);
        out.emit("num_vcpus", vcpus(resources), SourceUnit.COUNT);
        out.emit("memory_size_mib", scalar(resources.path("memory_size_mib")), SourceUnit.MIB);
        out.emit("disk_size_bytes", diskBytes(resources.path("disk_list")), SourceUnit.BYTES);
    }

    /**
     * Sockets times vCPUs per socket; a missing per-socket count means one.
     */
    private static Long vcpus(JsonNode resources) {
        JsonNode sockets = resources.path("num_sockets");
        if (!sockets.isNumber()) {
            return null;
        }
        JsonNode perSocket = resources.path("num_vcpus_per_socket");
        return sockets.asLong() * (perSocket.isNumber() ? perSocket.asLong() : 1L);
    }

    /**
     * Total provisioned disk bytes, or null when no disk reports a size.
     */
    private static Long diskBytes(JsonNode disks) {
        if (!disks.isArray()) {
            return null;
        }
        long total = 0;
        boolean sized = false;
        for (JsonNode disk : disks) {
            long bytes = disk.path("disk_size_bytes").asLong(0);
            if (bytes <= 0) {
                bytes = disk.path("disk_size_mib").asLong(0) * MIB;
            }
            if (bytes > 0) {
                total += bytes;
                sized = true;
            }
        }
        return sized ? total : null;
    }

    private Emitter emitter(ResourceKind kind, JsonNode entity, JsonNode clusterReference,
                            Instant observedAt, RecordSink sink) {
        String name = text(entity.path("spec"), "name");
        if (name == null) {
            name = text(entity.path("status"), "name");
        }
        String parentUuid = clusterReference != null ? text(clusterReference, "uuid") : null;
        String parentName = clusterReference != null ? text(clusterReference, "name") : null;
        return new Emitter(kind, text(entity.path("metadata"), "uuid"), name, parentUuid, parentName,
                observedAt, sink);
    }

    private record Emitter(ResourceKind kind, String uuid, String name, String parentUuid, String parentName,
                           Instant observedAt, RecordSink sink) {

        void emit(String field, Object value, SourceUnit unit) {
            sink.accept(new AdapterRecord(ApiGeneration.RESOURCE_LIST, kind, uuid, name, field, value, unit,
                    parentUuid, parentName, observedAt));
        }
    }
}
