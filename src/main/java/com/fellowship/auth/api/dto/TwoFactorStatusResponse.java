package com.fellowship.auth.api.dto;

/**
 * 二次验证状态。
 *
 * @param enabled              用户是否开启二次验证。
 * @param backupCodesRemaining 剩余备用码数量。
 * @param sessionVerified      当前会话是否已验证。
 */
public record TwoFactorStatusResponse(boolean enabled, int backupCodesRemaining, boolean sessionVerified) {
}
