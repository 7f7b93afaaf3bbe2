package com.fellowship.auth.twofactor;

import java.time.Instant;

/**
 * 用户已开启的二次验证登记。备用码单独存放，以便原子地逐个消费。
 *
 * @param userId       用户 ID。
 * @param secret       TOTP 密钥（Base32）。
 * @param enabledAt    开启时间。
 * @param lastUsedStep 最近一次被接受的 TOTP 步号，-1 表示尚未使用。
 */
public record TwoFactorEnrollment(long userId, String secret, Instant enabledAt, long lastUsedStep) {
}
