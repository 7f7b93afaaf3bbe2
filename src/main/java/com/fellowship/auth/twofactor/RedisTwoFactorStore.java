package com.fellowship.auth.twofactor;

import com.fellowship.auth.exception.SecurityStoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 基于 Redis 的二次验证存储实现。
 * <p>
 * 键空间：
 * - {@code auth:2fa:{userId}}：Hash，保存 secret、enabledAt、lastUsedStep；
 * - {@code auth:2fa:backup:{userId}}：Set，备用码摘要，SREM 即消费；
 * - {@code auth:2fa:pending:{sessionId}}：Hash，待确认挑战，TTL 控制有效期，status 字段原子推进即消费。
 */
public class RedisTwoFactorStore implements TwoFactorStore {

    private static final String FIELD_SECRET = "secret";
    private static final String FIELD_ENABLED_AT = "enabledAt";
    private static final String FIELD_LAST_USED_STEP = "lastUsedStep";
    private static final String FIELD_USER_ID = "userId";
    private static final String FIELD_BACKUP_CODES = "backupCodes";
    private static final String FIELD_STATUS = "status";
    private static final String FIELD_CREATED_AT = "createdAt";

    private final StringRedisTemplate redis;
    private final DefaultRedisScript<Long> advanceStepScript;
    private final DefaultRedisScript<Long> replaceCodesScript;
    private final DefaultRedisScript<Long> promoteChallengeScript;

    public RedisTwoFactorStore(StringRedisTemplate redis) {
        this.redis = redis;
        this.advanceStepScript = new DefaultRedisScript<>();
        this.advanceStepScript.setResultType(Long.class);
        this.advanceStepScript.setScriptText(ADVANCE_STEP_LUA);
        this.replaceCodesScript = new DefaultRedisScript<>();
        this.replaceCodesScript.setResultType(Long.class);
        this.replaceCodesScript.setScriptText(REPLACE_CODES_LUA);
        this.promoteChallengeScript = new DefaultRedisScript<>();
        this.promoteChallengeScript.setResultType(Long.class);
        this.promoteChallengeScript.setScriptText(PROMOTE_CHALLENGE_LUA);
    }

    @Override
    public Optional<TwoFactorEnrollment> findEnrollment(long userId) {
        return run("findEnrollment", () -> {
            HashOperations<String, String, String> ops = redis.opsForHash();
            Map<String, String> data = ops.entries(enrollmentKey(userId));
            if (data == null || data.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new TwoFactorEnrollment(
                    userId,
                    data.get(FIELD_SECRET),
                    Instant.ofEpochMilli(Long.parseLong(data.get(FIELD_ENABLED_AT))),
                    Long.parseLong(data.getOrDefault(FIELD_LAST_USED_STEP, "-1"))));
        });
    }

    @Override
    public void saveEnrollment(TwoFactorEnrollment enrollment, Set<String> backupCodeHashes) {
        run("saveEnrollment", () -> {
            Map<String, String> hash = new HashMap<>();
            hash.put(FIELD_SECRET, enrollment.secret());
            hash.put(FIELD_ENABLED_AT, String.valueOf(enrollment.enabledAt().toEpochMilli()));
            hash.put(FIELD_LAST_USED_STEP, String.valueOf(enrollment.lastUsedStep()));
            redis.opsForHash().putAll(enrollmentKey(enrollment.userId()), hash);
            return null;
        });
        replaceBackupCodes(enrollment.userId(), backupCodeHashes);
    }

    @Override
    public boolean deleteEnrollment(long userId) {
        return run("deleteEnrollment", () -> {
            Boolean deleted = redis.delete(enrollmentKey(userId));
            redis.delete(backupKey(userId));
            return Boolean.TRUE.equals(deleted);
        });
    }

    @Override
    public boolean consumeBackupCode(long userId, String codeHash) {
        Long removed = run("consumeBackupCode", () -> redis.opsForSet().remove(backupKey(userId), codeHash));
        return removed != null && removed == 1L;
    }

    @Override
    public void replaceBackupCodes(long userId, Set<String> backupCodeHashes) {
        List<String> args = new ArrayList<>(backupCodeHashes);
        run("replaceBackupCodes", () -> redis.execute(replaceCodesScript, List.of(backupKey(userId)), args.toArray()));
    }

    @Override
    public int countBackupCodes(long userId) {
        Long size = run("countBackupCodes", () -> redis.opsForSet().size(backupKey(userId)));
        return size == null ? 0 : size.intValue();
    }

    @Override
    public boolean advanceLastUsedStep(long userId, long step) {
        Long advanced = run("advanceLastUsedStep", () -> redis.execute(advanceStepScript,
                List.of(enrollmentKey(userId)), String.valueOf(step)));
        return advanced != null && advanced == 1L;
    }

    @Override
    public void savePendingChallenge(PendingTwoFactorChallenge challenge, Duration ttl) {
        String key = pendingKey(challenge.sessionId());
        run("savePendingChallenge", () -> {
            Map<String, String> hash = new HashMap<>();
            hash.put(FIELD_USER_ID, String.valueOf(challenge.userId()));
            hash.put(FIELD_SECRET, challenge.secret());
            hash.put(FIELD_BACKUP_CODES, String.join(",", challenge.backupCodeHashes()));
            hash.put(FIELD_STATUS, challenge.status().name());
            hash.put(FIELD_CREATED_AT, String.valueOf(challenge.createdAt().toEpochMilli()));
            redis.delete(key);
            redis.opsForHash().putAll(key, hash);
            redis.expire(key, ttl);
            return null;
        });
    }

    @Override
    public Optional<PendingTwoFactorChallenge> findPendingChallenge(String sessionId) {
        return run("findPendingChallenge", () -> {
            HashOperations<String, String, String> ops = redis.opsForHash();
            Map<String, String> data = ops.entries(pendingKey(sessionId));
            if (data == null || data.isEmpty()) {
                return Optional.empty();
            }
            String codes = data.getOrDefault(FIELD_BACKUP_CODES, "");
            Set<String> hashes = codes.isEmpty() ? Set.of()
                    : Arrays.stream(codes.split(",")).collect(Collectors.toSet());
            return Optional.of(new PendingTwoFactorChallenge(
                    sessionId,
                    Long.parseLong(data.get(FIELD_USER_ID)),
                    data.get(FIELD_SECRET),
                    hashes,
                    ChallengeStatus.valueOf(data.get(FIELD_STATUS)),
                    Instant.ofEpochMilli(Long.parseLong(data.get(FIELD_CREATED_AT)))));
        });
    }

    @Override
    public boolean promotePendingChallenge(String sessionId) {
        Long promoted = run("promotePendingChallenge", () -> redis.execute(promoteChallengeScript,
                List.of(pendingKey(sessionId)), ChallengeStatus.UNVERIFIED.name(), ChallengeStatus.VERIFIED.name()));
        return promoted != null && promoted == 1L;
    }

    private static String enrollmentKey(long userId) {
        return "auth:2fa:" + userId;
    }

    private static String backupKey(long userId) {
        return "auth:2fa:backup:" + userId;
    }

    private static String pendingKey(String sessionId) {
        return "auth:2fa:pending:" + sessionId;
    }

    private static <T> T run(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            throw new SecurityStoreException("Two-factor store operation failed: " + operation, ex);
        }
    }

    private static final String ADVANCE_STEP_LUA = """
            local cur = redis.call('HGET', KEYS[1], 'lastUsedStep')
            if not cur then return 0 end
            if tonumber(ARGV[1]) <= tonumber(cur) then return 0 end
            redis.call('HSET', KEYS[1], 'lastUsedStep', ARGV[1])
            return 1
            """;

    private static final String REPLACE_CODES_LUA = """
            redis.call('DEL', KEYS[1])
            if #ARGV > 0 then
              redis.call('SADD', KEYS[1], unpack(ARGV))
            end
            return #ARGV
            """;

    // HSET 不改变键的剩余 TTL
    private static final String PROMOTE_CHALLENGE_LUA = """
            local cur = redis.call('HGET', KEYS[1], 'status')
            if cur ~= ARGV[1] then return 0 end
            redis.call('HSET', KEYS[1], 'status', ARGV[2])
            return 1
            """;
}
