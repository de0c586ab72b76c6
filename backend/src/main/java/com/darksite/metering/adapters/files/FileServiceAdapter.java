package com.darksite.metering.adapters.files;

import com.darksite.metering.adapters.AdapterRecord;
import com.darksite.metering.adapters.ErrorCategory;
import com.darksite.metering.adapters.MeteringException;
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
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adapter for the v4.0 file-service API.
 *
 * DATA SOURCES:
 * 1. GET /config/file-servers - file server identities ({@code $page}/{@code $limit}, 0-based)
 * 2. GET /stats/file-servers/{extId} - capacity, usage, file and connection counts
 *
 * A cluster without the file service answers 404 on the listing; that is
 * reported as zero file servers, not as a failure. A failed stats call marks
 * the drain incomplete and moves on to the next file server.
 */
@Component
@Slf4j
public class FileServiceAdapter extends PaginatedEndpointAdapter {

    static final String LIST_PATH = "/config/file-servers";
    static final String STATS_PATH = "/stats/file-servers/";

    private final int pageSize;

    public FileServiceAdapter(PrismHttpClient client, MeteringProperties properties, Clock clock) {
        super(client, clock);
        this.pageSize = properties.getCollection().getFileServicePageSize();
    }

    @Override
    public ApiGeneration getGeneration() {
        return ApiGeneration.FILE_SERVICE;
    }

    @Override
    public Set<ResourceKind> getSupportedKinds() {
        return EnumSet.of(ResourceKind.FILE_SERVER);
    }

    @Override
    protected PageCursor firstPage(ResourceKind kind) {
        return new PageCursor(0, 0);
    }

    @Override
    protected Page fetchPage(ResourceKind kind, PageCursor cursor) {
        JsonNode response;
        try {
            response = client.get(getGeneration(), "v4.0/files/config/file-servers", LIST_PATH,
                    Map.of("$page", cursor.index(), "$limit", pageSize));
        } catch (MeteringException e) {
            if (e.isNotFound() && cursor.index() == 0) {
                log.info("File service not available on this cluster, reporting no file servers");
                return new Page(List.of(), null);
            }
            throw e;
        }

        JsonNode data = response.path("data");
        List<JsonNode> entities = new ArrayList<>();
        if (data.isArray()) {
            data.forEach(entities::add);
        } else if (!data.isMissingNode() && !data.isNull()) {
            throw new MeteringException(ErrorCategory.PERMANENT, "File server listing 'data' is not an array");
        }
        int total = response.path("metadata").path("totalAvailableResults").asInt(-1);
        var following = new PageCursor(cursor.index() + 1, cursor.fetched() + entities.size());
        return Page.of(entities, cursor, following, total, pageSize);
    }

    @Override
    protected void extract(ResourceKind kind, JsonNode fileServer, Instant observedAt, RecordSink sink) {
        String extId = text(fileServer, "extId");
        var out = new Emitter(extId, text(fileServer, "name"), observedAt, sink);
        if (extId == null) {
            // no stats call possible; the normalizer drops and counts it
            out.emit("extId", null, SourceUnit.COUNT);
            return;
        }

        JsonNode stats;
        try {
            stats = client.get(getGeneration(), "v4.0/files/stats/file-servers", STATS_PATH + extId, Map.of())
                    .path("data");
        } catch (MeteringException e) {
            if (e.getCategory() == ErrorCategory.AUTH_EXHAUSTED || Thread.currentThread().isInterrupted()) {
                throw e;
            }
            log.warn("Stats unavailable for file server {}: {}", extId, e.describe());
            sink.markIncomplete(e);
            return;
        }

        out.emit("storageCapacityBytes", scalar(stats.path("storageCapacityBytes")), SourceUnit.BYTES);
        out.emit("usedCapacityBytes", scalar(stats.path("usedCapacityBytes")), SourceUnit.BYTES);
        out.emit("availableCapacityBytes", scalar(stats.path("availableCapacityBytes")), SourceUnit.BYTES);
        out.emit("numberOfFiles", latest(stats.path("numberOfFiles")), SourceUnit.COUNT);
        out.emit("numberOfConnections", latest(stats.path("numberOfConnections")), SourceUnit.COUNT);
    }

    /**
     * Stats arrive either as a plain value or as a time series of {@code {timestamp, value}} points.
     */
    private static Object latest(JsonNode stat) {
        if (stat.isArray()) {
            if (stat.isEmpty()) {
                return null;
            }
            JsonNode last = stat.get(stat.size() - 1);
            return last.isObject() ? scalar(last.path("value")) : scalar(last);
        }
        return scalar(stat);
    }

    private record Emitter(String uuid, String name, Instant observedAt, RecordSink sink) {

        void emit(String field, Object value, SourceUnit unit) {
            sink.accept(new AdapterRecord(ApiGeneration.FILE_SERVICE, ResourceKind.FILE_SERVER, uuid, name,
                    field, value, unit, null, null, observedAt));
        }
    }
}
