package com.brandmetrics.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate outcome of one refresh run, returned to the trigger caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshReport {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_PARTIAL_FAILURE = "partial_failure";
    public static final String STATUS_FAILED = "failed";

    private String status;
    private Instant startedAt;
    private Long durationMs;
    private Integer tenantCount;
    private Map<String, Integer> counts;
    private List<TenantRefreshResult> results;

    public static RefreshReport of(List<TenantRefreshResult> results, Instant startedAt, long durationMs) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RefreshStatus status : RefreshStatus.values()) {
            counts.put(status.getWireName(), 0);
        }
        results.forEach(r -> counts.merge(r.getStatus().getWireName(), 1, Integer::sum));

        int succeeded = counts.get(RefreshStatus.SUCCEEDED.getWireName());
        String overall;
        if (succeeded == results.size()) {
            overall = STATUS_OK;
        } else if (succeeded == 0) {
            overall = STATUS_FAILED;
        } else {
            overall = STATUS_PARTIAL_FAILURE;
        }

        return RefreshReport.builder()
                .status(overall)
                .startedAt(startedAt)
                .durationMs(durationMs)
                .tenantCount(results.size())
                .counts(counts)
                .results(results)
                .build();
    }

    public int count(RefreshStatus status) {
        return counts.getOrDefault(status.getWireName(), 0);
    }
}
