package com.fellowship.auth.twofactor;

import com.fellowship.auth.audit.SecurityEventSink;
import com.fellowship.auth.audit.SecurityEvents;
import com.fellowship.auth.config.AuthProperties;
import com.fellowship.auth.exception.BusinessException;
import com.fellowship.auth.exception.ErrorCode;
import com.fellowship.auth.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 二次验证服务。
 * <p>
 * 职责：
 * - 设置：生成 TOTP 密钥与备用码，按会话保存待确认挑战；
 * - 开启：用动态码确认挑战，挑战只能被消费一次；
 * - 验证：TOTP（同一步只接受一次）或备用码（原子移除，只能使用一次），通过后标记会话；
 * - 关闭、重新生成备用码、查询状态。
 * 验证失败返回可重试的错误，不做锁定，频率限制由外部闸门负责。
 */
@Slf4j
public class TwoFactorService {

    private static final int BACKUP_CODE_BYTES = 4;
    private static final Pattern BACKUP_CODE_PATTERN = Pattern.compile("[A-Z0-9]{8}");

    private final TwoFactorStore store;
    private final SessionStore sessionStore;
    private final TotpGenerator totp;
    private final AuthProperties.TwoFactor properties;
    private final SecurityEventSink eventSink;
    private final Clock clock;
    private final BytesKeyGenerator backupCodeGenerator = KeyGenerators.secureRandom(BACKUP_CODE_BYTES);

    public TwoFactorService(TwoFactorStore store, SessionStore sessionStore, TotpGenerator totp,
                            AuthProperties.TwoFactor properties, SecurityEventSink eventSink, Clock clock) {
        this.store = store;
        this.sessionStore = sessionStore;
        this.totp = totp;
        this.properties = properties;
        this.eventSink = eventSink;
        this.clock = clock;
    }

    /**
     * 发起二次验证设置。
     *
     * @param userId      用户 ID。
     * @param sessionId   当前会话 ID，挑战与之绑定。
     * @param accountName 验证器应用中显示的账号名。
     * @return 密钥、provisioning 地址与备用码明文。
     * @throws BusinessException 已开启时抛出 {@link ErrorCode#TWO_FACTOR_ALREADY_ENABLED}。
     */
    public TwoFactorSetup setup(long userId, String sessionId, String accountName) {
        if (store.findEnrollment(userId).isPresent()) {
            throw new BusinessException(ErrorCode.TWO_FACTOR_ALREADY_ENABLED);
        }
        String secret = totp.generateSecret();
        List<String> backupCodes = generateBackupCodes();
        store.savePendingChallenge(new PendingTwoFactorChallenge(
                sessionId, userId, secret, hashAll(backupCodes), ChallengeStatus.UNVERIFIED, clock.instant()),
                properties.getPendingTtl());
        eventSink.info(SecurityEvents.TWO_FACTOR_SETUP, Map.of("userId", userId, "sessionId", sessionId));
        return new TwoFactorSetup(secret, totp.provisioningUri(properties.getIssuer(), accountName, secret), backupCodes);
    }

    /**
     * 用动态码确认设置并开启二次验证，同时把当前会话标记为已验证。
     *
     * @throws BusinessException 已开启、无待确认挑战或动态码错误时抛出。
     */
    public void enable(long userId, String sessionId, String code) {
        if (store.findEnrollment(userId).isPresent()) {
            throw new BusinessException(ErrorCode.TWO_FACTOR_ALREADY_ENABLED);
        }
        PendingTwoFactorChallenge challenge = store.findPendingChallenge(sessionId)
                .filter(pending -> pending.userId() == userId)
                .filter(pending -> pending.status() == ChallengeStatus.UNVERIFIED)
                .orElseThrow(() -> new BusinessException(ErrorCode.TWO_FACTOR_SETUP_NOT_FOUND));
        OptionalLong step = totp.matchStep(challenge.secret(), normalize(code), clock.instant(), properties.getSkewSteps());
        if (step.isEmpty()) {
            reportFailure(userId, "enable");
            throw new BusinessException(ErrorCode.TWO_FACTOR_CODE_INVALID);
        }
        if (!store.promotePendingChallenge(sessionId)) {
            throw new BusinessException(ErrorCode.TWO_FACTOR_SETUP_NOT_FOUND);
        }
        store.saveEnrollment(new TwoFactorEnrollment(userId, challenge.secret(), clock.instant(), step.getAsLong()),
                challenge.backupCodeHashes());
        sessionStore.markTwoFactorVerified(sessionId);
        eventSink.info(SecurityEvents.TWO_FACTOR_ENABLED, Map.of("userId", userId, "sessionId", sessionId));
    }

    /**
     * 校验动态码或备用码，通过后把会话标记为已验证。
     *
     * @param userId    用户 ID。
     * @param sessionId 当前会话 ID。
     * @param code      动态码或备用码。
     * @return 验证方式与剩余备用码数量。
     * @throws BusinessException 未开启或验证码错误时抛出。
     */
    public TwoFactorVerifyResult verify(long userId, String sessionId, String code) {
        TwoFactorEnrollment enrollment = requireEnrollment(userId);
        TwoFactorMethod method = verifyCode(enrollment, code)
                .orElseThrow(() -> {
                    reportFailure(userId, "verify");
                    return new BusinessException(ErrorCode.TWO_FACTOR_CODE_INVALID);
                });
        sessionStore.markTwoFactorVerified(sessionId);
        int remaining = store.countBackupCodes(userId);
        eventSink.info(SecurityEvents.TWO_FACTOR_VERIFIED, Map.of(
                "userId", userId,
                "sessionId", sessionId,
                "method", method.name(),
                "backupCodesRemaining", remaining));
        return new TwoFactorVerifyResult(method, remaining);
    }

    /**
     * 验证后关闭二次验证。
     */
    public void disable(long userId, String code) {
        TwoFactorEnrollment enrollment = requireEnrollment(userId);
        if (verifyCode(enrollment, code).isEmpty()) {
            reportFailure(userId, "disable");
            throw new BusinessException(ErrorCode.TWO_FACTOR_CODE_INVALID);
        }
        store.deleteEnrollment(userId);
        eventSink.info(SecurityEvents.TWO_FACTOR_DISABLED, Map.of("userId", userId));
    }

    /**
     * 验证后重新生成备用码，旧备用码全部失效。
     *
     * @return 新备用码明文。
     */
    public List<String> regenerateBackupCodes(long userId, String code) {
        TwoFactorEnrollment enrollment = requireEnrollment(userId);
        if (verifyCode(enrollment, code).isEmpty()) {
            reportFailure(userId, "regenerate_backup_codes");
            throw new BusinessException(ErrorCode.TWO_FACTOR_CODE_INVALID);
        }
        List<String> backupCodes = generateBackupCodes();
        store.replaceBackupCodes(userId, hashAll(backupCodes));
        eventSink.info(SecurityEvents.TWO_FACTOR_BACKUP_CODES_REGENERATED, Map.of("userId", userId));
        return backupCodes;
    }

    public TwoFactorStatus status(long userId) {
        if (store.findEnrollment(userId).isEmpty()) {
            return new TwoFactorStatus(false, 0);
        }
        return new TwoFactorStatus(true, store.countBackupCodes(userId));
    }

    private TwoFactorEnrollment requireEnrollment(long userId) {
        return store.findEnrollment(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.TWO_FACTOR_NOT_ENABLED));
    }

    private Optional<TwoFactorMethod> verifyCode(TwoFactorEnrollment enrollment, String rawCode) {
        String code = normalize(rawCode);
        if (code.isEmpty()) {
            return Optional.empty();
        }
        OptionalLong step = totp.matchStep(enrollment.secret(), code, clock.instant(), properties.getSkewSteps());
        if (step.isPresent()) {
            if (store.advanceLastUsedStep(enrollment.userId(), step.getAsLong())) {
                return Optional.of(TwoFactorMethod.TOTP);
            }
            log.warn("TOTP code replay rejected userId={} step={}", enrollment.userId(), step.getAsLong());
            return Optional.empty();
        }
        String backupCode = code.toUpperCase(Locale.ROOT);
        if (BACKUP_CODE_PATTERN.matcher(backupCode).matches()
                && store.consumeBackupCode(enrollment.userId(), hash(backupCode))) {
            return Optional.of(TwoFactorMethod.BACKUP_CODE);
        }
        return Optional.empty();
    }

    private List<String> generateBackupCodes() {
        List<String> codes = new ArrayList<>(properties.getBackupCodeCount());
        for (int i = 0; i < properties.getBackupCodeCount(); i++) {
            codes.add(new String(Hex.encode(backupCodeGenerator.generateKey())).toUpperCase(Locale.ROOT));
        }
        return codes;
    }

    private void reportFailure(long userId, String action) {
        eventSink.info(SecurityEvents.TWO_FACTOR_FAILED, Map.of("userId", userId, "action", action));
    }

    private static Set<String> hashAll(List<String> codes) {
        Set<String> hashes = new LinkedHashSet<>();
        codes.forEach(code -> hashes.add(hash(code)));
        return hashes;
    }

    static String hash(String backupCode) {
        return DigestUtils.sha256Hex(backupCode);
    }

    private static String normalize(String code) {
        return code == null ? "" : code.replace(" ", "").replace("-", "").trim();
    }
}
