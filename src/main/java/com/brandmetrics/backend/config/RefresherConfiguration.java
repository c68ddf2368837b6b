package com.brandmetrics.backend.config;

import com.brandmetrics.backend.util.TenantDiscovery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the immutable {@link RefresherConfig} once at startup.
 * Per-tenant variables come from the process environment, overlaid by any
 * {@code refresher.variables.*} entries so they can also live in application.yml.
 */
@Configuration
@Slf4j
public class RefresherConfiguration {

    @Value("${refresher.brands:}")
    private String brands;

    @Value("${refresher.total-config-count:0}")
    private int totalConfigCount;

    @Value("${refresher.cache.key-prefix:metrics}")
    private String cacheKeyPrefix;

    @Value("${refresher.cache.ttl-seconds:86400}")
    private long cacheTtlSeconds;

    @Value("${refresher.cache.preserve-old-seconds:0}")
    private long preserveOldSeconds;

    @Value("${refresher.trigger.token:}")
    private String triggerToken;

    @Value("${refresher.fetch.connection-timeout-ms:10000}")
    private long connectionTimeoutMs;

    @Value("${refresher.fetch.query-timeout-seconds:30}")
    private int queryTimeoutSeconds;

    @Value("${refresher.fetch.worker-threads:0}")
    private int workerThreads;

    @Value("${refresher.fetch.run-timeout-seconds:0}")
    private long runTimeoutSeconds;

    @Bean
    public RefresherConfig refresherConfig(Environment environment) {
        Map<String, String> variables = new HashMap<>(System.getenv());
        variables.putAll(Binder.get(environment)
                .bind("refresher.variables", Bindable.mapOf(String.class, String.class))
                .orElse(Map.of()));

        Map<String, Integer> slots = TenantDiscovery.slotIndex(totalConfigCount, variables);
        List<String> tenants = TenantDiscovery.discoverTenants(brands, totalConfigCount, variables);

        if (tenants.isEmpty()) {
            log.warn("⚠️ No brands configured. Set BRANDS or TOTAL_CONFIG_COUNT with BRAND_TAG_<i>.");
        } else {
            log.info("✅ Configured {} brand(s): {}", tenants.size(), tenants);
        }

        return RefresherConfig.builder()
                .tenants(tenants)
                .tenantSlots(slots)
                .variables(variables)
                .cacheKeyPrefix(cacheKeyPrefix)
                .cacheTtlSeconds(cacheTtlSeconds)
                .preserveOldSeconds(preserveOldSeconds)
                .triggerToken(triggerToken == null ? "" : triggerToken)
                .connectionTimeoutMs(connectionTimeoutMs)
                .queryTimeoutSeconds(queryTimeoutSeconds)
                .workerThreads(workerThreads)
                .runTimeoutSeconds(runTimeoutSeconds)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
