package com.brandmetrics.backend.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Resolved configuration for one tenant.
 * {@code queryOverride} is null when the default row-count strategy applies.
 */
@Value
@Builder
public class TenantConfig {
    String id;

    @ToString.Exclude
    String dataSourceUrl;

    String queryOverride;

    public boolean hasQueryOverride() {
        return queryOverride != null && !queryOverride.isBlank();
    }
}
