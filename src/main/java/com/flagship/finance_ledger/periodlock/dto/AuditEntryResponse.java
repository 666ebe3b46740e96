package com.flagship.finance_ledger.periodlock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.flagship.finance_ledger.audit.AuditLogEntry;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Audit record as returned by the history endpoint. Snapshots are embedded as JSON objects.
 */
@Value
@Builder
public class AuditEntryResponse {

    @JsonProperty("action")
    String action;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("user_role")
    String userRole;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("ip_address")
    String ipAddress;

    @JsonRawValue
    @JsonProperty("before")
    String before;

    @JsonRawValue
    @JsonProperty("after")
    String after;

    public static AuditEntryResponse from(AuditLogEntry entry) {
        return AuditEntryResponse.builder()
            .action(entry.getAction().name())
            .userId(entry.getUserId())
            .userRole(entry.getUserRole())
            .timestamp(entry.getTimestamp())
            .ipAddress(entry.getIpAddress())
            .before(entry.getBeforeSnapshot())
            .after(entry.getAfterSnapshot())
            .build();
    }
}
