package com.brandmetrics.backend.service;

import com.brandmetrics.backend.config.JacksonConfig;
import com.brandmetrics.backend.config.RefresherConfig;
import com.brandmetrics.backend.exception.MetricsFetchException;
import com.brandmetrics.backend.exception.SnapshotWriteException;
import com.brandmetrics.backend.model.MetricsPayload;
import com.brandmetrics.backend.model.MetricsSnapshot;
import com.brandmetrics.backend.model.RefreshReport;
import com.brandmetrics.backend.model.RefreshStatus;
import com.brandmetrics.backend.model.TenantConfig;
import com.brandmetrics.backend.model.TenantRefreshResult;
import com.brandmetrics.backend.repository.InMemorySnapshotStore;
import com.brandmetrics.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RefreshOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private MetricsFetcher metricsFetcher;

    private MutableClock clock;
    private InMemorySnapshotStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemorySnapshotStore(clock);
    }

    private RefreshOrchestrator orchestrator(RefresherConfig config) {
        return new RefreshOrchestrator(new TenantRegistry(config), metricsFetcher,
                new SnapshotCacheWriter(store, JacksonConfig.snapshotMapper(), config), config, clock);
    }

    private static MetricsSnapshot counts(String tenantId, long products) {
        return MetricsSnapshot.builder()
                .tenantId(tenantId)
                .fetchedAt(NOW)
                .payload(MetricsPayload.ofCounts(Map.of("products", products)))
                .build();
    }

    private static TenantConfig tenant(String id) {
        return argThat(t -> t != null && id.equals(t.getId()));
    }

    @Test
    void testRunAll_MissingDataSource_OtherTenantStillCached() throws Exception {
        RefresherConfig config = RefresherConfig.builder()
                .tenant("brandA")
                .tenant("brandB")
                .variable("BRANDA_DATABASE_URL", "mysql://u:p@a/shop")
                .build();
        when(metricsFetcher.fetch(any())).thenReturn(counts("brandA", 10));

        RefreshReport report = orchestrator(config).runAll();

        assertEquals(RefreshReport.STATUS_PARTIAL_FAILURE, report.getStatus());
        assertEquals(2, report.getTenantCount());
        assertEquals(1, report.count(RefreshStatus.SUCCEEDED));
        assertEquals(1, report.count(RefreshStatus.CONFIG_ERROR));

        TenantRefreshResult a = report.getResults().get(0);
        TenantRefreshResult b = report.getResults().get(1);
        assertEquals("brandA", a.getTenantId());
        assertEquals(RefreshStatus.SUCCEEDED, a.getStatus());
        assertEquals("metrics:brandA", a.getCacheKey());
        assertEquals("brandB", b.getTenantId());
        assertEquals(RefreshStatus.CONFIG_ERROR, b.getStatus());
        assertEquals("missingDataSource", b.getErrorCode());
        assertNull(b.getCacheKey());

        assertTrue(store.get("metrics:brandA").isPresent());
        assertTrue(store.get("metrics:brandB").isEmpty());
        verify(metricsFetcher, times(1)).fetch(any());
    }

    @Test
    void testRunAll_FailedTenantKeepsPreviousSnapshot() throws Exception {
        RefresherConfig config = RefresherConfig.builder()
                .tenant("brandA")
                .tenant("brandB")
                .variable("BRANDA_DATABASE_URL", "mysql://u:p@a/shop")
                .variable("BRANDB_DATABASE_URL", "mysql://u:p@b/shop")
                .build();
        store.set("metrics:brandB", "{\"tenantId\":\"brandB\",\"marker\":\"previous\"}", null);
        when(metricsFetcher.fetch(tenant("brandA"))).thenReturn(counts("brandA", 3));
        when(metricsFetcher.fetch(tenant("brandB"))).thenThrow(new MetricsFetchException("brandB",
                MetricsFetchException.Reason.CONNECTION_FAILED, "Connection refused", null));

        RefreshReport report = orchestrator(config).runAll();

        Map<String, TenantRefreshResult> byTenant = report.getResults().stream()
                .collect(Collectors.toMap(TenantRefreshResult::getTenantId, r -> r));
        assertEquals(RefreshStatus.FETCH_ERROR, byTenant.get("brandB").getStatus());
        assertEquals("connectionFailed", byTenant.get("brandB").getErrorCode());
        assertEquals("{\"tenantId\":\"brandB\",\"marker\":\"previous\"}", store.get("metrics:brandB").orElseThrow());
    }

    @Test
    void testRunAll_AllSucceed_StatusOk() throws Exception {
        RefresherConfig config = RefresherConfig.builder()
                .tenant("brandA")
                .tenant("brandB")
                .tenant("brandC")
                .variable("BRANDA_DATABASE_URL", "mysql://u:p@a/shop")
                .variable("BRAND_BRANDB_DATABASE_URL", "mysql://u:p@b/shop")
                .variable("brandc_DATABASE_URL", "mysql://u:p@c/shop")
                .workerThreads(2)
                .build();
        when(metricsFetcher.fetch(any())).thenAnswer(inv -> counts(inv.<TenantConfig>getArgument(0).getId(), 1));

        RefreshReport report = orchestrator(config).runAll();

        assertEquals(RefreshReport.STATUS_OK, report.getStatus());
        assertEquals(List.of("brandA", "brandB", "brandC"), report.getResults().stream()
                .map(TenantRefreshResult::getTenantId).collect(Collectors.toList()));
        assertTrue(store.get("metrics:brandC").isPresent());
    }

    @Test
    void testRunAll_NoTenants_EmptyOkReport() {
        RefreshReport report = orchestrator(RefresherConfig.builder().build()).runAll();

        assertEquals(RefreshReport.STATUS_OK, report.getStatus());
        assertEquals(0, report.getTenantCount());
        assertTrue(report.getResults().isEmpty());
        verifyNoInteractions(metricsFetcher);
    }

    @Test
    void testRunAll_EveryTenantFails_StatusFailed() {
        RefresherConfig config = RefresherConfig.builder().tenant("brandA").build();

        RefreshReport report = orchestrator(config).runAll();

        assertEquals(RefreshReport.STATUS_FAILED, report.getStatus());
        assertEquals(1, report.count(RefreshStatus.CONFIG_ERROR));
    }

    @Test
    void testRefreshTenant_CacheWriteFailure_Isolated() throws Exception {
        RefresherConfig config = RefresherConfig.builder()
                .tenant("brandA")
                .tenant("brandB")
                .variable("BRANDA_DATABASE_URL", "mysql://u:p@a/shop")
                .variable("BRANDB_DATABASE_URL", "mysql://u:p@b/shop")
                .build();
        SnapshotCacheWriter writer = mock(SnapshotCacheWriter.class);
        when(writer.store(eq("brandA"), any(MetricsSnapshot.class)))
                .thenThrow(new SnapshotWriteException("brandA", "Cache write failed", null));
        when(writer.store(eq("brandB"), any(MetricsSnapshot.class)))
                .thenReturn("metrics:brandB");
        when(metricsFetcher.fetch(any())).thenAnswer(inv -> counts(inv.<TenantConfig>getArgument(0).getId(), 1));
        RefreshOrchestrator orchestrator = new RefreshOrchestrator(new TenantRegistry(config), metricsFetcher,
                writer, config, clock);

        RefreshReport report = orchestrator.runAll();

        assertEquals(RefreshReport.STATUS_PARTIAL_FAILURE, report.getStatus());
        assertEquals(RefreshStatus.CACHE_WRITE_ERROR, report.getResults().get(0).getStatus());
        assertEquals("cacheWriteFailed", report.getResults().get(0).getErrorCode());
        assertEquals(RefreshStatus.SUCCEEDED, report.getResults().get(1).getStatus());
    }

    @Test
    void testRefreshTenant_UnexpectedFetcherError_ReportedAsFetchError() throws Exception {
        RefresherConfig config = RefresherConfig.builder()
                .tenant("brandA")
                .variable("BRANDA_DATABASE_URL", "mysql://u:p@a/shop")
                .build();
        when(metricsFetcher.fetch(any())).thenThrow(new IllegalStateException("driver bug"));

        TenantRefreshResult result = orchestrator(config).refreshTenant("brandA");

        assertEquals(RefreshStatus.FETCH_ERROR, result.getStatus());
        assertEquals("unexpectedError", result.getErrorCode());
        assertEquals(NOW, result.getTimestamp());
    }

    @Test
    void testRunAll_RunBudgetExceeded_SlowTenantTimedOut() throws Exception {
        RefresherConfig config = RefresherConfig.builder()
                .tenant("brandA")
                .tenant("slowBrand")
                .variable("BRANDA_DATABASE_URL", "mysql://u:p@a/shop")
                .variable("SLOWBRAND_DATABASE_URL", "mysql://u:p@slow/shop")
                .runTimeoutSeconds(1)
                .build();
        when(metricsFetcher.fetch(tenant("brandA"))).thenReturn(counts("brandA", 1));
        when(metricsFetcher.fetch(tenant("slowBrand"))).thenAnswer(inv -> {
            Thread.sleep(10_000);
            return counts("slowBrand", 1);
        });

        long start = System.currentTimeMillis();
        RefreshReport report = orchestrator(config).runAll();
        long elapsed = System.currentTimeMillis() - start;

        assertTrue(elapsed < 8_000, "run should stop waiting at the budget, took " + elapsed + "ms");
        assertEquals(RefreshStatus.SUCCEEDED, report.getResults().get(0).getStatus());
        assertEquals(RefreshStatus.FETCH_ERROR, report.getResults().get(1).getStatus());
        assertEquals("timedOut", report.getResults().get(1).getErrorCode());
        assertTrue(store.get("metrics:slowBrand").isEmpty());
    }

    @Test
    void testRunAll_FetchIgnoringInterruptFinishesLate_SnapshotNotCached() throws Exception {
        RefresherConfig config = RefresherConfig.builder()
                .tenant("brandA")
                .tenant("stuckBrand")
                .variable("BRANDA_DATABASE_URL", "mysql://u:p@a/shop")
                .variable("STUCKBRAND_DATABASE_URL", "mysql://u:p@stuck/shop")
                .runTimeoutSeconds(1)
                .build();
        CountDownLatch lateFetchReturned = new CountDownLatch(1);
        when(metricsFetcher.fetch(tenant("brandA"))).thenReturn(counts("brandA", 1));
        when(metricsFetcher.fetch(tenant("stuckBrand"))).thenAnswer(inv -> {
            // blocked I/O does not react to interrupts either
            long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (System.nanoTime() < until) {
                Thread.onSpinWait();
            }
            lateFetchReturned.countDown();
            return counts("stuckBrand", 1);
        });

        RefreshReport report = orchestrator(config).runAll();
        assertTrue(lateFetchReturned.await(5, TimeUnit.SECONDS));
        Thread.sleep(500);

        TenantRefreshResult stuck = report.getResults().get(1);
        assertEquals(RefreshStatus.FETCH_ERROR, stuck.getStatus());
        assertEquals("timedOut", stuck.getErrorCode());
        assertTrue(store.get("metrics:stuckBrand").isEmpty());
        assertTrue(store.get("metrics:brandA").isPresent());
    }

    @Test
    void testWorkerCount_BoundedByTenantsAndSetting() {
        RefreshOrchestrator fixed = orchestrator(RefresherConfig.builder().workerThreads(3).build());
        RefreshOrchestrator auto = orchestrator(RefresherConfig.builder().build());

        assertEquals(2, fixed.workerCount(2));
        assertEquals(3, fixed.workerCount(10));
        assertEquals(1, auto.workerCount(1));
        assertTrue(auto.workerCount(1000) >= 2);
    }
}
