package com.brandmetrics.backend.service;

import com.brandmetrics.backend.config.RefresherConfig;
import com.brandmetrics.backend.exception.TenantConfigException;
import com.brandmetrics.backend.model.TenantConfig;
import com.brandmetrics.backend.util.TenantVariableResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves tenant ids to their data source and query strategy.
 * Reads only the immutable {@link RefresherConfig}; no I/O.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TenantRegistry {

    private final RefresherConfig config;

    public List<String> tenantIds() {
        return config.getTenants();
    }

    public TenantConfig resolve(String tenantId) throws TenantConfigException {
        if (tenantId == null || !config.getTenants().contains(tenantId)) {
            throw new TenantConfigException(tenantId, TenantConfigException.Reason.UNKNOWN_TENANT,
                    "Tenant is not in the configured tenant list: " + tenantId);
        }

        List<String> urlCandidates = dataSourceCandidates(tenantId);
        Optional<String> dataSourceUrl = TenantVariableResolver.firstNonBlank(urlCandidates, config.getVariables());
        if (dataSourceUrl.isEmpty()) {
            throw new TenantConfigException(tenantId, TenantConfigException.Reason.MISSING_DATA_SOURCE,
                    "No data source URL set; tried " + urlCandidates);
        }

        String queryOverride = TenantVariableResolver.firstNonBlank(
                TenantVariableResolver.candidateNames(tenantId, TenantVariableResolver.METRICS_QUERY),
                config.getVariables()).orElse(null);

        log.debug("Resolved tenant {} (custom query: {})", tenantId, queryOverride != null);
        return TenantConfig.builder()
                .id(tenantId)
                .dataSourceUrl(dataSourceUrl.get())
                .queryOverride(queryOverride)
                .build();
    }

    List<String> dataSourceCandidates(String tenantId) {
        List<String> candidates = new ArrayList<>();
        config.slotOf(tenantId)
                .ifPresent(slot -> candidates.add(TenantVariableResolver.indexedConnectionName(slot)));
        candidates.addAll(TenantVariableResolver.candidateNames(tenantId, TenantVariableResolver.DATABASE_URL));
        return candidates;
    }
}
