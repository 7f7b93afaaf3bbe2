package com.fellowship.auth.api.dto;

import java.time.Instant;

/**
 * 过期会话清理结果。
 */
public record CleanupResponse(boolean success, int removed, Instant timestamp) {
}
