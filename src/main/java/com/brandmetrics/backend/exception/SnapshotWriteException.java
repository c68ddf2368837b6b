package com.brandmetrics.backend.exception;

import com.brandmetrics.backend.model.RefreshStatus;

public class SnapshotWriteException extends TenantRefreshException {

    public SnapshotWriteException(String tenantId, String message, Throwable cause) {
        super(tenantId, message, cause);
    }

    @Override
    public RefreshStatus getStatus() {
        return RefreshStatus.CACHE_WRITE_ERROR;
    }

    @Override
    public String getErrorCode() {
        return "cacheWriteFailed";
    }
}
