package com.flagship.finance_ledger.actor;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Gateway-supplied identity headers and the client address used for auditing.
 */
public final class ActorHeaders {

    public static final String ORGANIZATION_ID = "X-Organization-Id";
    public static final String USER_ID = "X-User-Id";
    public static final String USER_ROLE = "X-User-Role";
    public static final String FORWARDED_FOR = "X-Forwarded-For";

    private ActorHeaders() {
        // Utility class
    }

    public static Actor resolve(HttpServletRequest request) {
        return Actor.of(
                request.getHeader(USER_ID),
                UserRole.fromString(request.getHeader(USER_ROLE)),
                clientIp(request));
    }

    /**
     * First entry of X-Forwarded-For when behind a proxy, else the socket peer.
     */
    public static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].strip();
        }
        return request.getRemoteAddr();
    }
}
