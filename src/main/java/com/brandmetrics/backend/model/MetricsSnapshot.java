package com.brandmetrics.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The cache entry value: {@code { tenantId, fetchedAt, payload }}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSnapshot {
    private String tenantId;
    private Instant fetchedAt;
    private MetricsPayload payload;
}
