package com.flagship.finance_ledger.actor;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Organization roles as delivered by the caller's auth context.
 *
 * {@link #SYSTEM} is never sent by a caller; it identifies background jobs in the audit trail.
 */
public enum UserRole {
    ADMIN,
    OWNER,
    ACCOUNTANT,
    MANAGER,
    TECHNICIAN,
    DISPATCHER,
    SYSTEM,
    UNKNOWN;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse: unrecognized or missing roles map to {@link #UNKNOWN}, which no
     * permission check accepts.
     */
    public static UserRole fromString(String role) {
        if (role == null || role.isBlank()) {
            return UNKNOWN;
        }
        try {
            UserRole parsed = valueOf(role.strip().toUpperCase(Locale.ROOT));
            return parsed == SYSTEM ? UNKNOWN : parsed;
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
