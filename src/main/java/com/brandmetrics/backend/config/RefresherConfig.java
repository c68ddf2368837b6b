package com.brandmetrics.backend.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable process-wide configuration, captured once at startup.
 * Components receive this object instead of reading the environment themselves.
 */
@Value
@Builder(toBuilder = true)
public class RefresherConfig {

    public static final long DEFAULT_TTL_SECONDS = 86400L;

    /** Tenant ids in configured order. */
    @Singular
    List<String> tenants;

    /** Tenant id to its indexed configuration slot (TOTAL_CONFIG_COUNT style setups). */
    @Singular
    Map<String, Integer> tenantSlots;

    /** Snapshot of the configuration variables used for per-tenant lookups. */
    @Singular
    Map<String, String> variables;

    @Builder.Default
    String cacheKeyPrefix = "metrics";

    @Builder.Default
    long cacheTtlSeconds = DEFAULT_TTL_SECONDS;

    @Builder.Default
    long preserveOldSeconds = 0L;

    /** Empty means the trigger endpoint accepts unauthenticated calls. */
    @Builder.Default
    String triggerToken = "";

    @Builder.Default
    long connectionTimeoutMs = 10_000L;

    @Builder.Default
    int queryTimeoutSeconds = 30;

    /** 0 selects a worker count from the available processors. */
    @Builder.Default
    int workerThreads = 0;

    /** 0 disables the overall run budget. */
    @Builder.Default
    long runTimeoutSeconds = 0L;

    public Optional<Integer> slotOf(String tenantId) {
        return Optional.ofNullable(tenantSlots.get(tenantId));
    }

    public boolean isTriggerAuthEnabled() {
        return triggerToken != null && !triggerToken.isBlank();
    }
}
