package com.brandmetrics.backend.service;

import com.brandmetrics.backend.config.RefresherConfig;
import com.brandmetrics.backend.exception.MetricsFetchException;
import com.brandmetrics.backend.model.MetricsPayload;
import com.brandmetrics.backend.model.MetricsSnapshot;
import com.brandmetrics.backend.model.TableCount;
import com.brandmetrics.backend.model.TenantConfig;
import com.brandmetrics.backend.util.JdbcValues;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.SQLTransientException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one tenant's metrics from its transactional store.
 *
 * <p>With a query override the rows of that query are returned verbatim. Otherwise the
 * default tables are row-counted one by one; a table that cannot be counted on a healthy
 * connection is left out of the result, while a lost connection, a query timeout or any
 * other transient failure aborts the fetch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetricsFetcher {

    public static final List<String> DEFAULT_TABLES = List.of("products", "orders", "customers");

    private static final int MAX_VALIDITY_CHECK_SECONDS = 5;

    private final TenantDataSourceFactory dataSourceFactory;
    private final RefresherConfig config;
    private final Clock clock;

    public MetricsSnapshot fetch(TenantConfig tenant) throws MetricsFetchException {
        Instant fetchedAt = clock.instant();

        MetricsPayload payload;
        try (HikariDataSource dataSource = dataSourceFactory.open(tenant)) {
            Connection connection = connect(tenant, dataSource);
            try {
                payload = tenant.hasQueryOverride()
                        ? runCustomQuery(tenant, connection)
                        : countDefaultTables(tenant, connection);
            } finally {
                release(tenant, connection);
            }
        }

        return MetricsSnapshot.builder()
                .tenantId(tenant.getId())
                .fetchedAt(fetchedAt)
                .payload(payload)
                .build();
    }

    private void release(TenantConfig tenant, Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("⚠️ Failed to release connection for tenant {}: {}", tenant.getId(), e.getMessage());
        }
    }

    private Connection connect(TenantConfig tenant, HikariDataSource dataSource) throws MetricsFetchException {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new MetricsFetchException(tenant.getId(), MetricsFetchException.Reason.CONNECTION_FAILED,
                    "Cannot connect to data source: " + e.getMessage(), e);
        }
    }

    private MetricsPayload runCustomQuery(TenantConfig tenant, Connection connection) throws MetricsFetchException {
        log.debug("Running custom metrics query for tenant {}", tenant.getId());
        try (Statement statement = connection.createStatement()) {
            applyQueryTimeout(statement);
            try (ResultSet rs = statement.executeQuery(tenant.getQueryOverride())) {
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(JdbcValues.readRow(rs));
                }
                return MetricsPayload.ofCustomRows(rows);
            }
        } catch (SQLTimeoutException e) {
            throw new MetricsFetchException(tenant.getId(), MetricsFetchException.Reason.TIMED_OUT,
                    "Custom metrics query timed out after " + config.getQueryTimeoutSeconds() + "s", e);
        } catch (SQLException e) {
            throw new MetricsFetchException(tenant.getId(), MetricsFetchException.Reason.QUERY_FAILED,
                    "Custom metrics query failed: " + e.getMessage(), e);
        }
    }

    private MetricsPayload countDefaultTables(TenantConfig tenant, Connection connection)
            throws MetricsFetchException {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String table : DEFAULT_TABLES) {
            TableCount result = countTable(tenant, connection, table);
            if (result.isPresent()) {
                counts.put(result.getTable(), result.getRows());
            } else {
                log.debug("Table {} omitted for tenant {}: {}", table, tenant.getId(), result.getAbsenceReason());
            }
        }
        return MetricsPayload.ofCounts(counts);
    }

    TableCount countTable(TenantConfig tenant, Connection connection, String table) throws MetricsFetchException {
        try (Statement statement = connection.createStatement()) {
            applyQueryTimeout(statement);
            try (ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + table)) {
                if (!rs.next()) {
                    return TableCount.absent(table, "count query returned no rows");
                }
                return TableCount.counted(table, rs.getLong(1));
            }
        } catch (SQLException e) {
            if (isConnectionFailure(e, connection)) {
                throw new MetricsFetchException(tenant.getId(), MetricsFetchException.Reason.CONNECTION_FAILED,
                        "Connection lost while counting " + table + ": " + e.getMessage(), e);
            }
            if (e instanceof SQLTimeoutException) {
                throw new MetricsFetchException(tenant.getId(), MetricsFetchException.Reason.TIMED_OUT,
                        "Counting " + table + " timed out after " + config.getQueryTimeoutSeconds() + "s", e);
            }
            // a transient failure says nothing about whether the table exists
            if (e instanceof SQLTransientException) {
                throw new MetricsFetchException(tenant.getId(), MetricsFetchException.Reason.QUERY_FAILED,
                        "Counting " + table + " failed: " + e.getMessage(), e);
            }
            return TableCount.absent(table, e.getMessage());
        }
    }

    private boolean isConnectionFailure(SQLException e, Connection connection) {
        if (e instanceof SQLNonTransientConnectionException
                || e instanceof SQLTransientConnectionException
                || e instanceof SQLRecoverableException) {
            return true;
        }
        String sqlState = e.getSQLState();
        if (sqlState != null && sqlState.startsWith("08")) {
            return true;
        }
        try {
            return !connection.isValid(Math.min(MAX_VALIDITY_CHECK_SECONDS, Math.max(1, config.getQueryTimeoutSeconds())));
        } catch (SQLException validityError) {
            log.debug("Connection validity check failed", validityError);
            return true;
        }
    }

    private void applyQueryTimeout(Statement statement) throws SQLException {
        if (config.getQueryTimeoutSeconds() > 0) {
            statement.setQueryTimeout(config.getQueryTimeoutSeconds());
        }
    }
}
