package com.fellowship.auth.twofactor;

import java.time.Instant;
import java.util.Set;

/**
 * 待确认的二次验证开启挑战，按会话保存。
 *
 * @param sessionId        发起设置的会话 ID。
 * @param userId           用户 ID。
 * @param secret           新生成的 TOTP 密钥（Base32）。
 * @param backupCodeHashes 备用码的 SHA-256 摘要。
 * @param status           挑战状态。
 * @param createdAt        创建时间。
 */
public record PendingTwoFactorChallenge(
        String sessionId,
        long userId,
        String secret,
        Set<String> backupCodeHashes,
        ChallengeStatus status,
        Instant createdAt
) {

    public PendingTwoFactorChallenge {
        backupCodeHashes = Set.copyOf(backupCodeHashes);
    }

    public PendingTwoFactorChallenge withStatus(ChallengeStatus newStatus) {
        return new PendingTwoFactorChallenge(sessionId, userId, secret, backupCodeHashes, newStatus, createdAt);
    }
}
