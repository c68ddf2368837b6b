package com.brandmetrics.backend.repository;

import com.brandmetrics.backend.client.UpstashRestClient;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "refresher.cache.backend", havingValue = "upstash-rest")
@RequiredArgsConstructor
public class UpstashSnapshotStore implements SnapshotStore {

    private final UpstashRestClient upstashRestClient;

    @Override
    public void set(String key, String value, Duration ttl) {
        upstashRestClient.set(key, value, ttl != null ? ttl.getSeconds() : 0L);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(upstashRestClient.get(key));
    }
}
