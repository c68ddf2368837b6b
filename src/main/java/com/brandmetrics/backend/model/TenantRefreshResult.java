package com.brandmetrics.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TenantRefreshResult {
    private String tenantId;
    private RefreshStatus status;
    private String errorCode;
    private String message;
    private String cacheKey;
    private Instant timestamp;
    private Long processingTimeMs;

    @JsonIgnore
    public boolean isSucceeded() {
        return status == RefreshStatus.SUCCEEDED;
    }
}
