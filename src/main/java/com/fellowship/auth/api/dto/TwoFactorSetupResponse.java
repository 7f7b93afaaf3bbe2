package com.fellowship.auth.api.dto;

import java.util.List;

/**
 * 二次验证设置响应：密钥、{@code otpauth://} 地址与一次性展示的备用码。
 */
public record TwoFactorSetupResponse(String secret, String provisioningUri, List<String> backupCodes) {
}
