package com.fellowship.auth.api.dto;

/**
 * CSRF 令牌响应。前端将令牌放入 {@code X-CSRF-Token} 请求头。
 */
public record CsrfTokenResponse(String token) {
}
