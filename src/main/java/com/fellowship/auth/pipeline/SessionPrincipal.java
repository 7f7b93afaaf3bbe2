package com.fellowship.auth.pipeline;

/**
 * 控制器通过 {@code @AuthenticationPrincipal} 获取的当前会话身份。
 *
 * @param sessionId         会话 ID。
 * @param userId            用户 ID。
 * @param twoFactorVerified 本会话是否已通过二次验证。
 */
public record SessionPrincipal(String sessionId, long userId, boolean twoFactorVerified) {
}
