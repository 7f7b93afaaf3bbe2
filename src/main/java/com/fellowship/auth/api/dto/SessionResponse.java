package com.fellowship.auth.api.dto;

import com.fellowship.auth.session.SessionRecord;

import java.time.Instant;

/**
 * 会话列表项。
 */
public record SessionResponse(
        String id,
        String deviceInfo,
        String ipAddress,
        String userAgent,
        Instant createdAt,
        Instant lastActivity,
        Instant expiresAt,
        boolean current
) {

    public static SessionResponse from(SessionRecord session, String currentSessionId) {
        return new SessionResponse(
                session.id(),
                session.deviceInfo(),
                session.ipAddress(),
                session.userAgent(),
                session.createdAt(),
                session.lastActivity(),
                session.expiresAt(),
                session.id().equals(currentSessionId));
    }
}
