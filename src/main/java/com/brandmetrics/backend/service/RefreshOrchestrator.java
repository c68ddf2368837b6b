package com.brandmetrics.backend.service;

import com.brandmetrics.backend.config.RefresherConfig;
import com.brandmetrics.backend.exception.MetricsFetchException;
import com.brandmetrics.backend.exception.TenantRefreshException;
import com.brandmetrics.backend.model.MetricsSnapshot;
import com.brandmetrics.backend.model.RefreshReport;
import com.brandmetrics.backend.model.RefreshStatus;
import com.brandmetrics.backend.model.TenantConfig;
import com.brandmetrics.backend.model.TenantRefreshResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs resolve, fetch and store for every configured tenant and folds the
 * per-tenant outcomes into one report. A failing tenant never stops the others,
 * and nothing is retried within a run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RefreshOrchestrator {

        private final TenantRegistry tenantRegistry;
        private final MetricsFetcher metricsFetcher;
        private final SnapshotCacheWriter snapshotCacheWriter;
        private final RefresherConfig config;
        private final Clock clock;

        private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

        /**
         * Refresh all configured tenants
         *
         * @return Aggregate report, one result per tenant in configured order
         */
        public RefreshReport runAll() {
                Instant startedAt = clock.instant();
                long startMillis = System.currentTimeMillis();
                List<String> tenants = tenantRegistry.tenantIds();

                log.info("═══════════════════════════════════════════════════════════════════");
                log.info("📊 METRICS REFRESH STARTED | Brands: {} | Time: {}", tenants,
                                LocalDateTime.now(clock).format(TIME_FORMATTER));
                log.info("═══════════════════════════════════════════════════════════════════");

                List<TenantRefreshResult> results = tenants.size() <= 1
                                ? tenants.stream().map(this::refreshTenant).collect(Collectors.toList())
                                : refreshInParallel(tenants);

                long totalDuration = System.currentTimeMillis() - startMillis;
                RefreshReport report = RefreshReport.of(results, startedAt, totalDuration);

                log.info("═══════════════════════════════════════════════════════════════════");
                log.info("📊 METRICS REFRESH ENDED | Status: {} | Counts: {} | Total Time: {}ms",
                                report.getStatus(), report.getCounts(), totalDuration);
                log.info("═══════════════════════════════════════════════════════════════════");
                return report;
        }

        private List<TenantRefreshResult> refreshInParallel(List<String> tenants) {
                int workers = workerCount(tenants.size());
                ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
                try {
                        List<AtomicBoolean> storeClaims = tenants.stream()
                                        .map(tenant -> new AtomicBoolean())
                                        .collect(Collectors.toList());
                        List<CompletableFuture<TenantRefreshResult>> futures = new ArrayList<>(tenants.size());
                        for (int i = 0; i < tenants.size(); i++) {
                                String tenant = tenants.get(i);
                                AtomicBoolean storeClaim = storeClaims.get(i);
                                futures.add(CompletableFuture.supplyAsync(() -> refreshTenant(tenant, storeClaim), executor));
                        }

                        if (config.getRunTimeoutSeconds() <= 0) {
                                return futures.stream()
                                                .map(CompletableFuture::join)
                                                .collect(Collectors.toList());
                        }
                        return awaitWithinBudget(tenants, futures, storeClaims);
                } finally {
                        // interrupts tasks still running after the run budget ran out
                        executor.shutdownNow();
                }
        }

        /**
         * Waits for each tenant until the run budget is spent. A tenant still fetching at that
         * point is reported as timed out and loses its right to write to the cache; one that
         * already started its cache write is awaited, so the report always matches the cache.
         */
        private List<TenantRefreshResult> awaitWithinBudget(List<String> tenants,
                        List<CompletableFuture<TenantRefreshResult>> futures, List<AtomicBoolean> storeClaims) {
                long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.getRunTimeoutSeconds());
                List<TenantRefreshResult> results = new ArrayList<>(tenants.size());

                for (int i = 0; i < futures.size(); i++) {
                        String tenantId = tenants.get(i);
                        CompletableFuture<TenantRefreshResult> future = futures.get(i);
                        try {
                                long remaining = Math.max(0L, deadline - System.nanoTime());
                                results.add(future.get(remaining, TimeUnit.NANOSECONDS));
                        } catch (TimeoutException e) {
                                if (storeClaims.get(i).compareAndSet(false, true)) {
                                        future.cancel(true);
                                        log.error("⏱️ STATUS: TIMED OUT | Brand {} did not finish within the {}s run budget",
                                                        tenantId, config.getRunTimeoutSeconds());
                                        results.add(timedOut(tenantId,
                                                        "Refresh did not finish within " + config.getRunTimeoutSeconds() + "s"));
                                } else {
                                        log.info("⏳ Brand {} is already writing its snapshot, waiting for it", tenantId);
                                        results.add(awaitStore(tenantId, future));
                                }
                        } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                                storeClaims.get(i).set(true);
                                future.cancel(true);
                                results.add(timedOut(tenantId, "Refresh run was interrupted"));
                        } catch (ExecutionException e) {
                                results.add(unexpected(tenantId, e.getCause()));
                        }
                }
                return results;
        }

        private TenantRefreshResult awaitStore(String tenantId, CompletableFuture<TenantRefreshResult> future) {
                try {
                        return future.get();
                } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return timedOut(tenantId, "Refresh run was interrupted during the cache write");
                } catch (ExecutionException e) {
                        return unexpected(tenantId, e.getCause());
                }
        }

        private TenantRefreshResult timedOut(String tenantId, String message) {
                return failure(tenantId, RefreshStatus.FETCH_ERROR, MetricsFetchException.Reason.TIMED_OUT.getCode(),
                                message, clock.instant(), 0L);
        }

        private TenantRefreshResult unexpected(String tenantId, Throwable cause) {
                log.error("❌ Unexpected failure refreshing brand {}", tenantId, cause);
                return failure(tenantId, RefreshStatus.FETCH_ERROR, "unexpectedError", String.valueOf(cause),
                                clock.instant(), 0L);
        }

        /**
         * Resolve, fetch and store one tenant. Never throws; failures are returned as results.
         *
         * @param tenantId Tenant identifier
         * @return Outcome for this tenant
         */
        public TenantRefreshResult refreshTenant(String tenantId) {
                return refreshTenant(tenantId, new AtomicBoolean());
        }

        /**
         * @param storeClaim set by whoever acts first: this worker before writing the cache, or the
         *                   run budget when it gives up on the tenant
         */
        private TenantRefreshResult refreshTenant(String tenantId, AtomicBoolean storeClaim) {
                Instant timestamp = clock.instant();
                long startMillis = System.currentTimeMillis();

                log.info("───────────────────────────────────────────────────────────────────");
                log.info("🏷️ REFRESHING BRAND: {}", tenantId);
                log.info("───────────────────────────────────────────────────────────────────");

                // status to report if something unexpected escapes the current stage
                RefreshStatus stage = RefreshStatus.CONFIG_ERROR;
                try {
                        TenantConfig tenant = tenantRegistry.resolve(tenantId);

                        stage = RefreshStatus.FETCH_ERROR;
                        log.info("📡 Fetching {} metrics for brand: {}",
                                        tenant.hasQueryOverride() ? "custom query" : "default table count", tenantId);
                        MetricsSnapshot snapshot = metricsFetcher.fetch(tenant);

                        if (!storeClaim.compareAndSet(false, true)) {
                                log.warn("⏱️ Brand {} finished after the run budget; snapshot discarded", tenantId);
                                return failure(tenantId, RefreshStatus.FETCH_ERROR,
                                                MetricsFetchException.Reason.TIMED_OUT.getCode(),
                                                "Finished after the run budget; snapshot not cached", timestamp,
                                                System.currentTimeMillis() - startMillis);
                        }

                        stage = RefreshStatus.CACHE_WRITE_ERROR;
                        String cacheKey = snapshotCacheWriter.store(tenantId, snapshot);

                        long duration = System.currentTimeMillis() - startMillis;
                        log.info("✅ SUMMARY: Brand={} | {} → {} | TTL: {}s | Took: {}ms", tenantId,
                                        describe(snapshot), cacheKey, config.getCacheTtlSeconds(), duration);

                        return TenantRefreshResult.builder()
                                        .tenantId(tenantId)
                                        .status(RefreshStatus.SUCCEEDED)
                                        .cacheKey(cacheKey)
                                        .timestamp(timestamp)
                                        .processingTimeMs(duration)
                                        .message("Cached " + describe(snapshot))
                                        .build();

                } catch (TenantRefreshException e) {
                        long duration = System.currentTimeMillis() - startMillis;
                        if (e.getStatus() == RefreshStatus.CONFIG_ERROR) {
                                log.warn("⚠️  STATUS: {}({}) | Brand {} skipped: {}", e.getStatus().getWireName(),
                                                e.getErrorCode(), tenantId, e.getMessage());
                        } else {
                                log.error("❌ STATUS: {}({}) | Brand {} failed after {}ms: {}",
                                                e.getStatus().getWireName(), e.getErrorCode(), tenantId, duration,
                                                e.getMessage(), e.getCause());
                        }
                        return failure(tenantId, e.getStatus(), e.getErrorCode(), e.getMessage(), timestamp, duration);

                } catch (RuntimeException e) {
                        long duration = System.currentTimeMillis() - startMillis;
                        log.error("❌ STATUS: {}(unexpectedError) | Brand {} failed after {}ms", stage.getWireName(),
                                        tenantId, duration, e);
                        return failure(tenantId, stage, "unexpectedError", e.getMessage(), timestamp, duration);
                }
        }

        private TenantRefreshResult failure(String tenantId, RefreshStatus status, String errorCode, String message,
                        Instant timestamp, long duration) {
                return TenantRefreshResult.builder()
                                .tenantId(tenantId)
                                .status(status)
                                .errorCode(errorCode)
                                .message(message)
                                .timestamp(timestamp)
                                .processingTimeMs(duration)
                                .build();
        }

        private static String describe(MetricsSnapshot snapshot) {
                if (snapshot.getPayload().isCustom()) {
                        return snapshot.getPayload().getCustomRows().size() + " custom rows";
                }
                return "counts " + snapshot.getPayload().getCounts();
        }

        int workerCount(int tenantCount) {
                int configured = config.getWorkerThreads() > 0
                                ? config.getWorkerThreads()
                                : Math.max(1, Runtime.getRuntime().availableProcessors() * 2);
                return Math.max(1, Math.min(tenantCount, configured));
        }

        private static ThreadFactory workerThreadFactory() {
                AtomicInteger counter = new AtomicInteger();
                return runnable -> {
                        Thread thread = new Thread(runnable, "refresh-worker-" + counter.incrementAndGet());
                        thread.setDaemon(true);
                        return thread;
                };
        }
}
