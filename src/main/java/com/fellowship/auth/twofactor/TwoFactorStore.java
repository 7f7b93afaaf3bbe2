package com.fellowship.auth.twofactor;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * 二次验证存储接口。
 * <p>
 * 备用码消费、挑战消费与步号推进都必须是单条原子命令，保证至多成功一次；
 * 后端不可用时抛出 {@link com.fellowship.auth.exception.SecurityStoreException}。
 */
public interface TwoFactorStore {

    Optional<TwoFactorEnrollment> findEnrollment(long userId);

    /** 保存登记并整体替换备用码集合。 */
    void saveEnrollment(TwoFactorEnrollment enrollment, Set<String> backupCodeHashes);

    /** @return 是否删除了已有登记。 */
    boolean deleteEnrollment(long userId);

    /**
     * 消费一个备用码。
     *
     * @return 该摘要存在并被本次调用移除时返回 true。
     */
    boolean consumeBackupCode(long userId, String codeHash);

    void replaceBackupCodes(long userId, Set<String> backupCodeHashes);

    int countBackupCodes(long userId);

    /**
     * 当 {@code step} 大于已记录的步号时推进，防止同一步的动态码被重复使用。
     *
     * @return 是否推进成功。
     */
    boolean advanceLastUsedStep(long userId, long step);

    void savePendingChallenge(PendingTwoFactorChallenge challenge, Duration ttl);

    Optional<PendingTwoFactorChallenge> findPendingChallenge(String sessionId);

    /**
     * 把未过期的待确认挑战从 {@link ChallengeStatus#UNVERIFIED} 推进到 {@link ChallengeStatus#VERIFIED}。
     * 已确认的挑战保留到有效期结束，不能再次确认。
     *
     * @return 本次调用完成推进时返回 true，可作为“只消费一次”的判定。
     */
    boolean promotePendingChallenge(String sessionId);
}
