package com.brandmetrics.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RefreshStatus {
    SUCCEEDED("succeeded"),
    CONFIG_ERROR("configError"),
    FETCH_ERROR("fetchError"),
    CACHE_WRITE_ERROR("cacheWriteError");

    private final String wireName;

    RefreshStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
