package com.brandmetrics.backend.exception;

import com.brandmetrics.backend.model.RefreshStatus;

public class TenantConfigException extends TenantRefreshException {

    public enum Reason {
        UNKNOWN_TENANT("unknownTenant"),
        MISSING_DATA_SOURCE("missingDataSource");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String getCode() {
            return code;
        }
    }

    private final Reason reason;

    public TenantConfigException(String tenantId, Reason reason, String message) {
        super(tenantId, message, null);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public RefreshStatus getStatus() {
        return RefreshStatus.CONFIG_ERROR;
    }

    @Override
    public String getErrorCode() {
        return reason.getCode();
    }
}
