package com.flagship.finance_ledger.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One append-only audit record.
 *
 * Snapshots are JSON documents of the resource before and after the action; either may be
 * null (no record before a first lock, nothing after a failed action).
 */
@Value
@Builder
public class AuditLogEntry {
    UUID id;
    String organizationId;
    String userId;
    String userRole;
    AuditAction action;
    String resourceType;
    String resourceId;
    Instant timestamp;
    String ipAddress;
    String beforeSnapshot;
    String afterSnapshot;
}
