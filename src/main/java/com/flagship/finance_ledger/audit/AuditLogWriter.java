package com.flagship.finance_ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.finance_ledger.actor.Actor;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Records lock transitions and posting actions in the audit trail.
 *
 * Audit is best-effort: a failed write is logged at error level and counted, but it never
 * propagates to the operation that triggered it and never rolls that operation back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditLogWriter {

    private final AuditLogStore store;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Appends one record.
     *
     * @param before resource state before the action, serialized to JSON (nullable)
     * @param after resource state after the action, serialized to JSON (nullable)
     * @return true if the record was written
     */
    public boolean append(String organizationId, Actor actor, AuditAction action,
                          String resourceType, String resourceId, Object before, Object after) {
        try {
            AuditLogEntry entry = AuditLogEntry.builder()
                .id(UUID.randomUUID())
                .organizationId(organizationId)
                .userId(actor.getUserId())
                .userRole(actor.getRole().wireValue())
                .action(action)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .timestamp(clock.instant())
                .ipAddress(actor.getIpAddress())
                .beforeSnapshot(toJson(before))
                .afterSnapshot(toJson(after))
                .build();

            store.append(entry);

            log.debug("Audit recorded: action={}, resourceType={}, resourceId={}, user={}",
                    action, resourceType, resourceId, actor.getUserId());
            return true;

        } catch (Exception e) {
            metrics.recordAuditWriteFailure(action.name());
            log.error("Audit write failed: action={}, organizationId={}, resourceType={}, resourceId={}, error={}",
                    action, organizationId, resourceType, resourceId, e.getMessage(), e);
            return false;
        }
    }

    public List<AuditLogEntry> history(String organizationId, String resourceType, String resourceId) {
        return store.history(organizationId, resourceType, resourceId);
    }

    private String toJson(Object snapshot) throws JsonProcessingException {
        return snapshot == null ? null : objectMapper.writeValueAsString(snapshot);
    }
}
