package com.brandmetrics.backend.service;

import com.brandmetrics.backend.config.RefresherConfig;
import com.brandmetrics.backend.exception.SnapshotWriteException;
import com.brandmetrics.backend.model.MetricsSnapshot;
import com.brandmetrics.backend.repository.SnapshotStore;
import com.brandmetrics.backend.util.SnapshotKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Writes a tenant's snapshot to the cache under {@code <prefix>:<tenantId>}, last write wins.
 * When previous-snapshot preservation is enabled the value being replaced is copied to
 * {@code <prefix>:<tenantId>:old} with its own short TTL.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotCacheWriter {

    private final SnapshotStore snapshotStore;
    private final ObjectMapper objectMapper;
    private final RefresherConfig config;

    public String keyFor(String tenantId) {
        return SnapshotKeys.current(config.getCacheKeyPrefix(), tenantId);
    }

    public String store(String tenantId, MetricsSnapshot snapshot) throws SnapshotWriteException {
        return store(tenantId, snapshot, Duration.ofSeconds(config.getCacheTtlSeconds()));
    }

    /**
     * @return the cache key written
     */
    public String store(String tenantId, MetricsSnapshot snapshot, Duration ttl) throws SnapshotWriteException {
        String key = keyFor(tenantId);

        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new SnapshotWriteException(tenantId, "Failed to serialize snapshot for key " + key, e);
        }

        Optional<String> previous = readPrevious(key);

        try {
            snapshotStore.set(key, json, ttl);
        } catch (RuntimeException e) {
            throw new SnapshotWriteException(tenantId, "Cache write failed for key " + key + ": " + e.getMessage(), e);
        }
        log.debug("Cached snapshot: key={}, ttl={}s, bytes={}", key, ttl.getSeconds(), json.length());

        previous.ifPresent(value -> preserve(tenantId, value));
        return key;
    }

    private Optional<String> readPrevious(String key) {
        if (config.getPreserveOldSeconds() <= 0) {
            return Optional.empty();
        }
        try {
            return snapshotStore.get(key);
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not read previous snapshot for key {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void preserve(String tenantId, String previousValue) {
        String oldKey = SnapshotKeys.previous(config.getCacheKeyPrefix(), tenantId);
        try {
            snapshotStore.set(oldKey, previousValue, Duration.ofSeconds(config.getPreserveOldSeconds()));
            log.trace("Preserved previous snapshot under {}", oldKey);
        } catch (RuntimeException e) {
            log.warn("⚠️ Could not preserve previous snapshot under {}: {}", oldKey, e.getMessage());
        }
    }
}
