package com.fellowship.auth.twofactor;

/**
 * 二次验证通过后的结果。
 *
 * @param method               使用的验证方式。
 * @param backupCodesRemaining 剩余备用码数量。
 */
public record TwoFactorVerifyResult(TwoFactorMethod method, int backupCodesRemaining) {
}
