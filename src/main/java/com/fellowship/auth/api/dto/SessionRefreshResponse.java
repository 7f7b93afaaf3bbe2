package com.fellowship.auth.api.dto;

import java.time.Instant;

/**
 * 会话续期响应。
 */
public record SessionRefreshResponse(String sessionId, Instant expiresAt) {
}
