package com.brandmetrics.backend.controller;

import com.brandmetrics.backend.model.RefreshReport;
import com.brandmetrics.backend.service.RefreshOrchestrator;
import com.brandmetrics.backend.service.TriggerAuthenticator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Refresh", description = "Trigger a metrics refresh for every configured brand")
public class RefreshController {

    private final TriggerAuthenticator triggerAuthenticator;
    private final RefreshOrchestrator refreshOrchestrator;

    /**
     * Refresh all configured brands. Partial failures still answer 200; the
     * report carries the per-brand outcome.
     *
     * @param authorization Bearer token when trigger authentication is enabled
     * @return Aggregate refresh report
     */
    @Operation(summary = "Trigger Refresh", description = "Fetches metrics for every configured brand and replaces their cached snapshots.")
    @ApiResponse(responseCode = "200", description = "Run completed, see per-brand results")
    @ApiResponse(responseCode = "401", description = "Missing or wrong bearer token")
    @PostMapping({ "/api/v1/refresh", "/qstash" })
    public ResponseEntity<RefreshReport> refresh(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        triggerAuthenticator.authenticate(authorization);

        log.info("🔄 Refresh triggered for all configured brands");
        RefreshReport report = refreshOrchestrator.runAll();

        return ResponseEntity.ok(report);
    }
}
