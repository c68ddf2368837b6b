package com.brandmetrics.backend.controller;

import com.brandmetrics.backend.model.MetricsSnapshot;
import com.brandmetrics.backend.service.MetricsSnapshotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/metrics")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Metrics", description = "Read cached brand metric snapshots")
public class MetricsController {

    private final MetricsSnapshotService metricsSnapshotService;

    @Operation(summary = "Get Brand Snapshot", description = "Returns the latest cached metrics snapshot for one brand.")
    @ApiResponse(responseCode = "200", description = "Snapshot found")
    @ApiResponse(responseCode = "204", description = "No recent data for this brand")
    @GetMapping("/{tenantId}")
    public ResponseEntity<MetricsSnapshot> getSnapshot(
            @Parameter(description = "Brand identifier", example = "brandA") @PathVariable String tenantId) {
        log.info("📥 Request: Metrics snapshot for brand {}", tenantId);
        return metricsSnapshotService.getSnapshot(tenantId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @Operation(summary = "Get All Snapshots", description = "Returns the cached snapshots of every configured brand that has one.")
    @GetMapping
    public ResponseEntity<Map<String, MetricsSnapshot>> getAllSnapshots() {
        return ResponseEntity.ok(metricsSnapshotService.getAllSnapshots());
    }
}
