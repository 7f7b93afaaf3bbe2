package com.fellowship.auth.twofactor;

import java.util.List;

/**
 * 二次验证设置结果。备用码明文只在此返回一次。
 *
 * @param secret          TOTP 密钥（Base32），供手动录入。
 * @param provisioningUri {@code otpauth://} 地址，供生成二维码。
 * @param backupCodes     备用码明文。
 */
public record TwoFactorSetup(String secret, String provisioningUri, List<String> backupCodes) {
}
