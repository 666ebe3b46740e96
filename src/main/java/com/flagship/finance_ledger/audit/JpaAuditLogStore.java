package com.flagship.finance_ledger.audit;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Audit store backed by the audit_logs table.
 *
 * Appends run in their own transaction so a failed insert cannot mark the caller's
 * transaction rollback-only.
 */
@Component
@RequiredArgsConstructor
public class JpaAuditLogStore implements AuditLogStore {

    private final AuditLogRepository repository;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void append(AuditLogEntry entry) {
        repository.save(AuditLogEntity.fromDomain(entry));
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditLogEntry> history(String organizationId, String resourceType, String resourceId) {
        return repository
            .findByOrganizationIdAndResourceTypeAndResourceIdOrderByTimestampDesc(
                organizationId, resourceType, resourceId)
            .stream()
            .map(AuditLogEntity::toDomain)
            .toList();
    }
}
