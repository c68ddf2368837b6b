package com.brandmetrics.backend.exception;

import com.brandmetrics.backend.model.RefreshStatus;

/**
 * Base type for failures that are scoped to a single tenant.
 * The orchestrator records these in the run report and moves on to the next tenant.
 */
public abstract class TenantRefreshException extends Exception {

    private final String tenantId;

    protected TenantRefreshException(String tenantId, String message, Throwable cause) {
        super(message, cause);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }

    /** Report status this failure maps to. */
    public abstract RefreshStatus getStatus();

    /** Short machine readable code, e.g. {@code missingDataSource}. */
    public abstract String getErrorCode();
}
