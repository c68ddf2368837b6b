package com.brandmetrics.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Metrics for one tenant. Exactly one of {@code customRows} (query override)
 * or {@code counts} (default tables) is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MetricsPayload {
    private List<Map<String, Object>> customRows;
    private Map<String, Long> counts;

    public static MetricsPayload ofCustomRows(List<Map<String, Object>> rows) {
        return MetricsPayload.builder().customRows(rows).build();
    }

    public static MetricsPayload ofCounts(Map<String, Long> counts) {
        return MetricsPayload.builder().counts(counts).build();
    }

    @JsonIgnore
    public boolean isCustom() {
        return customRows != null;
    }
}
