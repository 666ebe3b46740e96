package com.flagship.finance_ledger.audit;

import java.util.List;

/**
 * Persistence port for audit records.
 */
public interface AuditLogStore {

    void append(AuditLogEntry entry);

    /**
     * Entries for one resource, newest first.
     */
    List<AuditLogEntry> history(String organizationId, String resourceType, String resourceId);
}
