package com.fellowship.auth.api.dto;

/**
 * @param method               验证方式：TOTP 或 BACKUP_CODE。
 * @param backupCodesRemaining 剩余备用码数量。
 */
public record TwoFactorVerifyResponse(String method, int backupCodesRemaining) {
}
