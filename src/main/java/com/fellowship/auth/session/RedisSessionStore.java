package com.fellowship.auth.session;

import com.fellowship.auth.exception.SecurityStoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 基于 Redis 的会话存储实现。
 * <p>
 * 键空间：
 * - {@code auth:session:{sessionId}}：Hash，保存会话字段，PEXPIREAT 设为过期时间加一天宽限；
 * - {@code auth:session:user:{userId}}：Set，用户的会话 ID 索引；
 * - {@code auth:session:expiry}：ZSet，score 为过期毫秒时间戳，供清理任务扫描。
 * 条件更新与撤销通过 Lua 脚本完成，单条命令内要么全部生效要么不生效。
 */
public class RedisSessionStore implements SessionStore {

    private static final String SESSION_KEY_PREFIX = "auth:session:";
    private static final String USER_INDEX_PREFIX = "auth:session:user:";
    private static final String EXPIRY_INDEX_KEY = "auth:session:expiry";
    private static final Duration KEY_GRACE = Duration.ofDays(1);

    private static final String FIELD_USER_ID = "userId";
    private static final String FIELD_CREATED_AT = "createdAt";
    private static final String FIELD_LAST_ACTIVITY = "lastActivity";
    private static final String FIELD_EXPIRES_AT = "expiresAt";
    private static final String FIELD_TWO_FACTOR_VERIFIED = "twoFactorVerified";
    private static final String FIELD_DEVICE_INFO = "deviceInfo";
    private static final String FIELD_IP_ADDRESS = "ipAddress";
    private static final String FIELD_USER_AGENT = "userAgent";

    private final StringRedisTemplate redis;
    private final DefaultRedisScript<Long> refreshScript;
    private final DefaultRedisScript<Long> markVerifiedScript;
    private final DefaultRedisScript<Long> revokeScript;

    public RedisSessionStore(StringRedisTemplate redis) {
        this.redis = redis;
        this.refreshScript = script(REFRESH_LUA);
        this.markVerifiedScript = script(MARK_VERIFIED_LUA);
        this.revokeScript = script(REVOKE_LUA);
    }

    @Override
    public void saveSession(SessionRecord session) {
        String key = sessionKey(session.id());
        run("saveSession", () -> {
            HashOperations<String, String, String> ops = redis.opsForHash();
            ops.putAll(key, toHash(session));
            redis.expireAt(key, session.expiresAt().plus(KEY_GRACE));
            redis.opsForSet().add(userIndexKey(session.userId()), session.id());
            redis.opsForZSet().add(EXPIRY_INDEX_KEY, session.id(), session.expiresAt().toEpochMilli());
            return null;
        });
    }

    @Override
    public Optional<SessionRecord> getSession(String sessionId) {
        return run("getSession", () -> {
            HashOperations<String, String, String> ops = redis.opsForHash();
            Map<String, String> data = ops.entries(sessionKey(sessionId));
            if (data == null || data.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(fromHash(sessionId, data));
        });
    }

    @Override
    public boolean refreshSession(String sessionId, Instant lastActivity, Instant expiresAt) {
        Long updated = run("refreshSession", () -> redis.execute(refreshScript,
                List.of(sessionKey(sessionId), EXPIRY_INDEX_KEY),
                String.valueOf(lastActivity.toEpochMilli()),
                String.valueOf(expiresAt.toEpochMilli()),
                String.valueOf(expiresAt.plus(KEY_GRACE).toEpochMilli()),
                sessionId));
        return updated != null && updated == 1L;
    }

    @Override
    public boolean markTwoFactorVerified(String sessionId) {
        Long updated = run("markTwoFactorVerified", () -> redis.execute(markVerifiedScript,
                List.of(sessionKey(sessionId))));
        return updated != null && updated == 1L;
    }

    @Override
    public List<SessionRecord> listSessions(long userId) {
        return run("listSessions", () -> {
            String indexKey = userIndexKey(userId);
            Set<String> ids = redis.opsForSet().members(indexKey);
            List<SessionRecord> sessions = new ArrayList<>();
            if (ids == null) {
                return sessions;
            }
            HashOperations<String, String, String> ops = redis.opsForHash();
            for (String id : ids) {
                Map<String, String> data = ops.entries(sessionKey(id));
                if (data == null || data.isEmpty()) {
                    // Hash 已因 TTL 消失，顺手清理索引
                    redis.opsForSet().remove(indexKey, id);
                    redis.opsForZSet().remove(EXPIRY_INDEX_KEY, id);
                    continue;
                }
                sessions.add(fromHash(id, data));
            }
            return sessions;
        });
    }

    @Override
    public boolean revokeSession(String sessionId) {
        return revoke(sessionId, Long.MAX_VALUE);
    }

    @Override
    public int revokeSessions(long userId, String exceptSessionId) {
        Set<String> ids = run("revokeSessions", () -> redis.opsForSet().members(userIndexKey(userId)));
        if (ids == null) {
            return 0;
        }
        int revoked = 0;
        for (String id : ids) {
            if (id.equals(exceptSessionId)) {
                continue;
            }
            if (revoke(id, Long.MAX_VALUE)) {
                revoked++;
            }
        }
        return revoked;
    }

    @Override
    public int cleanupExpired(Instant now) {
        long nowMillis = now.toEpochMilli();
        Set<String> candidates = run("cleanupExpired",
                () -> redis.opsForZSet().rangeByScore(EXPIRY_INDEX_KEY, Double.NEGATIVE_INFINITY, nowMillis));
        if (candidates == null) {
            return 0;
        }
        int removed = 0;
        for (String id : candidates) {
            // 脚本内复核过期时间，期间被续期的会话不会被误删
            if (revoke(id, nowMillis)) {
                removed++;
            }
        }
        return removed;
    }

    private boolean revoke(String sessionId, long expiredBeforeMillis) {
        Long removed = run("revokeSession", () -> redis.execute(revokeScript,
                List.of(sessionKey(sessionId), EXPIRY_INDEX_KEY),
                sessionId,
                USER_INDEX_PREFIX,
                String.valueOf(expiredBeforeMillis)));
        return removed != null && removed == 1L;
    }

    private static Map<String, String> toHash(SessionRecord session) {
        Map<String, String> hash = new HashMap<>();
        hash.put(FIELD_USER_ID, String.valueOf(session.userId()));
        hash.put(FIELD_CREATED_AT, String.valueOf(session.createdAt().toEpochMilli()));
        hash.put(FIELD_LAST_ACTIVITY, String.valueOf(session.lastActivity().toEpochMilli()));
        hash.put(FIELD_EXPIRES_AT, String.valueOf(session.expiresAt().toEpochMilli()));
        hash.put(FIELD_TWO_FACTOR_VERIFIED, session.twoFactorVerified() ? "1" : "0");
        hash.put(FIELD_DEVICE_INFO, nullToEmpty(session.deviceInfo()));
        hash.put(FIELD_IP_ADDRESS, nullToEmpty(session.ipAddress()));
        hash.put(FIELD_USER_AGENT, nullToEmpty(session.userAgent()));
        return hash;
    }

    private static SessionRecord fromHash(String sessionId, Map<String, String> data) {
        return new SessionRecord(
                sessionId,
                Long.parseLong(data.get(FIELD_USER_ID)),
                instant(data.get(FIELD_CREATED_AT)),
                instant(data.get(FIELD_LAST_ACTIVITY)),
                instant(data.get(FIELD_EXPIRES_AT)),
                "1".equals(data.get(FIELD_TWO_FACTOR_VERIFIED)),
                emptyToNull(data.get(FIELD_DEVICE_INFO)),
                emptyToNull(data.get(FIELD_IP_ADDRESS)),
                emptyToNull(data.get(FIELD_USER_AGENT)));
    }

    private static Instant instant(String millis) {
        return millis == null ? Instant.EPOCH : Instant.ofEpochMilli(Long.parseLong(millis));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static String sessionKey(String sessionId) {
        return SESSION_KEY_PREFIX + sessionId;
    }

    private static String userIndexKey(long userId) {
        return USER_INDEX_PREFIX + userId;
    }

    private static DefaultRedisScript<Long> script(String text) {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setResultType(Long.class);
        script.setScriptText(text);
        return script;
    }

    private static <T> T run(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            throw new SecurityStoreException("Session store operation failed: " + operation, ex);
        }
    }

    private static final String REFRESH_LUA = """
            if redis.call('EXISTS', KEYS[1]) == 0 then return 0 end
            redis.call('HSET', KEYS[1], 'lastActivity', ARGV[1], 'expiresAt', ARGV[2])
            redis.call('PEXPIREAT', KEYS[1], ARGV[3])
            redis.call('ZADD', KEYS[2], ARGV[2], ARGV[4])
            return 1
            """;

    private static final String MARK_VERIFIED_LUA = """
            if redis.call('EXISTS', KEYS[1]) == 0 then return 0 end
            redis.call('HSET', KEYS[1], 'twoFactorVerified', '1')
            return 1
            """;

    // ARGV[3]：仅当 expiresAt <= ARGV[3] 时删除
    private static final String REVOKE_LUA = """
            local userId = redis.call('HGET', KEYS[1], 'userId')
            if not userId then
              redis.call('ZREM', KEYS[2], ARGV[1])
              return 0
            end
            local exp = tonumber(redis.call('HGET', KEYS[1], 'expiresAt'))
            if exp and exp > tonumber(ARGV[3]) then return 0 end
            local removed = redis.call('DEL', KEYS[1])
            redis.call('ZREM', KEYS[2], ARGV[1])
            redis.call('SREM', ARGV[2] .. userId, ARGV[1])
            return removed
            """;
}
