package com.fellowship.auth.twofactor;

/**
 * @param enabled              是否已开启。
 * @param backupCodesRemaining 剩余备用码数量。
 */
public record TwoFactorStatus(boolean enabled, int backupCodesRemaining) {
}
