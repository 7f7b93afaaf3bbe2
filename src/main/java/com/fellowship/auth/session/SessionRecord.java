package com.fellowship.auth.session;

import java.time.Instant;

/**
 * 服务端会话记录。
 *
 * @param id                会话 ID（即 {@code session_id} Cookie 的值）。
 * @param userId            所属用户 ID。
 * @param createdAt         创建时间。
 * @param lastActivity      最近活跃时间（粗粒度更新）。
 * @param expiresAt         过期时间。
 * @param twoFactorVerified 本会话是否已通过二次验证。
 * @param deviceInfo        设备描述（由 User-Agent 解析）。
 * @param ipAddress         创建时的客户端 IP。
 * @param userAgent         创建时的 User-Agent。
 */
public record SessionRecord(
        String id,
        long userId,
        Instant createdAt,
        Instant lastActivity,
        Instant expiresAt,
        boolean twoFactorVerified,
        String deviceInfo,
        String ipAddress,
        String userAgent
) {

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public SessionRecord withLastActivity(Instant lastActivity) {
        return new SessionRecord(id, userId, createdAt, lastActivity, expiresAt, twoFactorVerified, deviceInfo, ipAddress, userAgent);
    }

    public SessionRecord withExpiresAt(Instant expiresAt) {
        return new SessionRecord(id, userId, createdAt, lastActivity, expiresAt, twoFactorVerified, deviceInfo, ipAddress, userAgent);
    }

    public SessionRecord withTwoFactorVerified(boolean twoFactorVerified) {
        return new SessionRecord(id, userId, createdAt, lastActivity, expiresAt, twoFactorVerified, deviceInfo, ipAddress, userAgent);
    }
}
