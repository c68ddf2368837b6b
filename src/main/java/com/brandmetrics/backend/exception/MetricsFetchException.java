package com.brandmetrics.backend.exception;

import com.brandmetrics.backend.model.RefreshStatus;

/**
 * A tenant's fetch was aborted. {@link Reason#QUERY_FAILED} means the data source was
 * reachable but the query was rejected, so it can be alerted on separately from
 * {@link Reason#CONNECTION_FAILED}.
 */
public class MetricsFetchException extends TenantRefreshException {

    public enum Reason {
        CONNECTION_FAILED("connectionFailed"),
        QUERY_FAILED("queryFailed"),
        TIMED_OUT("timedOut");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    private final Reason reason;

    public MetricsFetchException(String tenantId, Reason reason, String message, Throwable cause) {
        super(tenantId, message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public RefreshStatus getStatus() {
        return RefreshStatus.FETCH_ERROR;
    }

    @Override
    public String getErrorCode() {
        return reason.getCode();
    }
}
