package com.flagship.finance_ledger.actor;

import lombok.Value;

import java.util.Set;

/**
 * Who is performing an operation, as recorded in the audit trail.
 */
@Value
public class Actor {

    public static final String AUTO_RELOCK_USER = "system_auto_relock";

    String userId;
    UserRole role;
    String ipAddress;

    public static Actor of(String userId, UserRole role, String ipAddress) {
        return new Actor(userId == null || userId.isBlank() ? "unknown" : userId, role, ipAddress);
    }

    public static Actor system(String userId) {
        return new Actor(userId, UserRole.SYSTEM, null);
    }

    public boolean hasAnyRole(Set<UserRole> allowed) {
        return allowed.contains(role);
    }
}
