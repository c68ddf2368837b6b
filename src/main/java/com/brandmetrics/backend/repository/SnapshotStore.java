package com.brandmetrics.backend.repository;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store holding serialized metrics snapshots.
 * Implementations are shared across tenants; keys are disjoint per tenant, so no locking.
 * Failures surface as unchecked exceptions from the underlying client.
 */
public interface SnapshotStore {

    /**
     * Store a value, replacing any previous one. A zero or negative TTL stores without expiry.
     */
    void set(String key, String value, Duration ttl);

    /**
     * Current value, or empty when the key is missing or has expired.
     */
    Optional<String> get(String key);
}
