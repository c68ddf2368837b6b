package com.brandmetrics.backend.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for development and tests. Expiry is evaluated lazily
 * against the injected clock on read.
 */
@Repository
@ConditionalOnProperty(name = "refresher.cache.backend", havingValue = "memory")
@Slf4j
public class InMemorySnapshotStore implements SnapshotStore {

    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public InMemorySnapshotStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Instant expiresAt = ttl != null && !ttl.isZero() && !ttl.isNegative()
                ? clock.instant().plus(ttl)
                : null;
        entries.put(key, new Entry(value, expiresAt));
        log.trace("Saved in memory: key={}, expiresAt={}", key, expiresAt);
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt != null && !clock.instant().isBefore(entry.expiresAt)) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    private static final class Entry {
        private final String value;
        private final Instant expiresAt;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
