package com.flagship.finance_ledger.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for audit_logs.
 *
 * Rows are insert-only: every column is non-updatable, the entity is {@link Immutable}, and
 * there are no setters. {@link #fromDomain(AuditLogEntry)} is the only way to build one.
 */
@Entity
@Immutable
@Table(
    name = "audit_logs",
    indexes = {
        @Index(name = "idx_audit_logs_resource", columnList = "organization_id, resource_type, resource_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditLogEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private String organizationId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "user_role", updatable = false, length = 50)
    private String userRole;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 50)
    private AuditAction action;

    @Column(name = "resource_type", nullable = false, updatable = false, length = 50)
    private String resourceType;

    @Column(name = "resource_id", nullable = false, updatable = false)
    private String resourceId;

    @Column(nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "ip_address", updatable = false, length = 64)
    private String ipAddress;

    @Column(name = "before_snapshot", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String beforeSnapshot;

    @Column(name = "after_snapshot", updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String afterSnapshot;

    public static AuditLogEntity fromDomain(AuditLogEntry entry) {
        return new AuditLogEntity(
            entry.getId(),
            entry.getOrganizationId(),
            entry.getUserId(),
            entry.getUserRole(),
            entry.getAction(),
            entry.getResourceType(),
            entry.getResourceId(),
            entry.getTimestamp(),
            entry.getIpAddress(),
            entry.getBeforeSnapshot(),
            entry.getAfterSnapshot()
        );
    }

    public AuditLogEntry toDomain() {
        return AuditLogEntry.builder()
            .id(id)
            .organizationId(organizationId)
            .userId(userId)
            .userRole(userRole)
            .action(action)
            .resourceType(resourceType)
            .resourceId(resourceId)
            .timestamp(timestamp)
            .ipAddress(ipAddress)
            .beforeSnapshot(beforeSnapshot)
            .afterSnapshot(afterSnapshot)
            .build();
    }
}
