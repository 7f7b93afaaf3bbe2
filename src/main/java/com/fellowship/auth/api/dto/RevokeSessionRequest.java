package com.fellowship.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 撤销单个会话请求。
 */
public record RevokeSessionRequest(@NotBlank(message = "会话 ID 不能为空") String sessionId) {
}
