package com.darksite.metering.scheduler;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator endpoint for running the daily export out of schedule.
 */
@RestController
@RequestMapping("/api/export")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Export", description = "Billing export operations")
public class ExportController {

    private final MeteringScheduler scheduler;

    /**
     * Queues an export; the file appears in the export directory once written.
     */
    @PostMapping("/run")
    @Operation(summary = "Run the daily export now",
               description = "Collects a fresh snapshot and writes a billing export asynchronously")
    public ResponseEntity<Map<String, String>> runExport() {
        log.info("Export requested through API");
        scheduler.triggerNow(MeteringScheduler.DAILY_EXPORT);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("task", MeteringScheduler.DAILY_EXPORT, "status", "ACCEPTED"));
    }
}
