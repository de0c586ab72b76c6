package com.darksite.metering.exposition;

import com.darksite.metering.domain.model.KindState;
import com.darksite.metering.domain.model.ResourceKind;
import com.darksite.metering.domain.model.Snapshot;
import com.darksite.metering.registry.MetricRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pull endpoints over the currently served snapshot.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "Metrics", description = "Exposition of the current snapshot")
public class MetricsExpositionController {

    static final String EXPOSITION_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final MetricRegistry registry;
    private final TextExpositionRenderer renderer;

    /**
     * Exposition text; empty before the first cycle completes.
     */
    @GetMapping(value = "/metrics", produces = EXPOSITION_CONTENT_TYPE)
    @Operation(summary = "Scrape the current snapshot")
    public ResponseEntity<String> scrape() {
        return ResponseEntity.ok(renderer.render(registry.current()));
    }

    @GetMapping("/api/snapshot/status")
    @Operation(summary = "Version, collection time and per-kind status of the current snapshot")
    public SnapshotStatus status() {
        Snapshot snapshot = registry.current();
        return new SnapshotStatus(
                snapshot.getVersion(),
                snapshot.isNeverCollected() ? null : snapshot.getCollectedAt(),
                snapshot.getRecords().size(),
                new LinkedHashMap<>(snapshot.getKindStates()));
    }

    public record SnapshotStatus(long version, Instant collectedAt, int records, Map<ResourceKind, KindState> kinds) {}
}
