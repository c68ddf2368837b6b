package com.brandmetrics.backend.service;

import com.brandmetrics.backend.config.RefresherConfig;
import com.brandmetrics.backend.model.MetricsSnapshot;
import com.brandmetrics.backend.repository.SnapshotStore;
import com.brandmetrics.backend.util.SnapshotKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the snapshot cache. A missing or expired key means
 * "no recent data" and is returned as empty, not as an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetricsSnapshotService {

    private final SnapshotStore snapshotStore;
    private final ObjectMapper objectMapper;
    private final RefresherConfig config;

    public Optional<MetricsSnapshot> getSnapshot(String tenantId) {
        String key = SnapshotKeys.current(config.getCacheKeyPrefix(), tenantId);
        Optional<String> json = snapshotStore.get(key);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), MetricsSnapshot.class));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize snapshot for key: {}", key, e);
            return Optional.empty();
        }
    }

    /**
     * Snapshots of every configured tenant that currently has one, in configured order.
     */
    public Map<String, MetricsSnapshot> getAllSnapshots() {
        Map<String, MetricsSnapshot> snapshots = new LinkedHashMap<>();
        for (String tenantId : config.getTenants()) {
            getSnapshot(tenantId).ifPresent(snapshot -> snapshots.put(tenantId, snapshot));
        }
        return snapshots;
    }
}
