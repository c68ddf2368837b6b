package com.brandmetrics.backend.controller;

import com.brandmetrics.backend.config.RefresherConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Liveness check")
public class HealthController {

    private final RefresherConfig config;

    @Operation(summary = "Health", description = "Reports that the service is up and which brands it refreshes.")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("brands", config.getTenants());
        return ResponseEntity.ok(body);
    }
}
