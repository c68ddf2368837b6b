package com.brandmetrics.backend.service;

import com.brandmetrics.backend.config.RefresherConfig;
import com.brandmetrics.backend.exception.MetricsFetchException;
import com.brandmetrics.backend.model.TenantConfig;
import com.brandmetrics.backend.util.DataSourceUrls;
import com.brandmetrics.backend.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Opens a single-connection pool for one fetch. The caller owns the returned
 * data source and must close it, so connections are never shared between
 * tenants or between runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TenantDataSourceFactory {

    private static final long MIN_TIMEOUT_MS = 250L;
    private static final long MAX_VALIDATION_TIMEOUT_MS = 5_000L;

    private final RefresherConfig config;

    public HikariDataSource open(TenantConfig tenant) throws MetricsFetchException {
        JdbcConnectionInfo info;
        try {
            info = DataSourceUrls.toJdbc(tenant.getDataSourceUrl());
        } catch (IllegalArgumentException e) {
            throw new MetricsFetchException(tenant.getId(), MetricsFetchException.Reason.CONNECTION_FAILED,
                    e.getMessage(), e);
        }

        long connectionTimeout = Math.max(MIN_TIMEOUT_MS, config.getConnectionTimeoutMs());

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(info.getUrl());
        if (info.getUsername() != null) {
            hikariConfig.setUsername(info.getUsername());
        }
        if (info.getPassword() != null) {
            hikariConfig.setPassword(info.getPassword());
        }
        hikariConfig.setPoolName("tenant-" + tenant.getId());
        hikariConfig.setMaximumPoolSize(1);
        hikariConfig.setMinimumIdle(0);
        hikariConfig.setConnectionTimeout(connectionTimeout);
        hikariConfig.setValidationTimeout(Math.max(MIN_TIMEOUT_MS, Math.min(MAX_VALIDATION_TIMEOUT_MS, connectionTimeout - 1)));
        // Fail on getConnection() instead of in the constructor
        hikariConfig.setInitializationFailTimeout(-1);

        log.debug("Opening {} data source for tenant {}: {}", info.getDbType(), tenant.getId(),
                DataSourceUrls.maskUrl(info.getUrl()));
        try {
            return new HikariDataSource(hikariConfig);
        } catch (RuntimeException e) {
            throw new MetricsFetchException(tenant.getId(), MetricsFetchException.Reason.CONNECTION_FAILED,
                    "Could not create data source: " + e.getMessage(), e);
        }
    }
}
