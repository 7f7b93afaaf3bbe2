package com.fellowship.auth.session;

import com.fellowship.auth.audit.SecurityEventSink;
import com.fellowship.auth.audit.SecurityEvents;
import com.fellowship.auth.config.AuthProperties;
import com.fellowship.auth.exception.BusinessException;
import com.fellowship.auth.exception.ErrorCode;
import com.fellowship.auth.model.ClientInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 服务端会话生命周期管理。
 * <p>
 * 职责：
 * - 登录成功后创建会话并限制每个用户的会话数量；
 * - 解析请求携带的会话 ID，惰性撤销已过期会话；
 * - 粗粒度更新最近活跃时间、滑动续期；
 * - 列出、撤销（单个/其余全部）会话，登出；
 * - 批量清理过期会话。
 * 所有写操作都是存储层的单条原子命令，并发的活跃度更新按最后写入为准。
 */
@Slf4j
public class SessionLifecycleService {

    private static final int SESSION_ID_BYTES = 32;

    private final SessionStore store;
    private final AuthProperties.Session properties;
    private final SecurityEventSink eventSink;
    private final Clock clock;
    private final BytesKeyGenerator idGenerator = KeyGenerators.secureRandom(SESSION_ID_BYTES);

    public SessionLifecycleService(SessionStore store, AuthProperties.Session properties,
                                   SecurityEventSink eventSink, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.eventSink = eventSink;
        this.clock = clock;
    }

    /**
     * 为已完成登录的用户创建会话。
     *
     * @param userId 用户 ID。
     * @param client 客户端信息。
     * @return 新会话。
     */
    public SessionRecord createSession(long userId, ClientInfo client) {
        Instant now = clock.instant();
        SessionRecord session = new SessionRecord(
                new String(Hex.encode(idGenerator.generateKey())),
                userId,
                now,
                now,
                now.plus(properties.getTtl()),
                false,
                DeviceDescriptor.describe(client.userAgent()),
                client.ip(),
                client.userAgent());
        store.saveSession(session);
        trimSessions(userId, session.id());
        eventSink.info(SecurityEvents.SESSION_CREATED, Map.of(
                "userId", userId,
                "sessionId", session.id(),
                "deviceInfo", session.deviceInfo()));
        return session;
    }

    /**
     * 解析会话 ID。
     *
     * @param sessionId 会话 ID，可为 null。
     * @return 未过期的会话；不存在或已过期时为空（过期会话顺带撤销）。
     */
    public Optional<SessionRecord> resolve(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        Optional<SessionRecord> found = store.getSession(sessionId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        SessionRecord session = found.get();
        if (session.isExpired(clock.instant())) {
            store.revokeSession(sessionId);
            log.debug("Expired session revoked on access sessionId={}", sessionId);
            return Optional.empty();
        }
        return found;
    }

    /**
     * 记录活跃：距离上次更新超过配置间隔才写入存储。
     *
     * @param session 当前会话。
     * @return 更新后的会话视图。
     */
    public SessionRecord recordActivity(SessionRecord session) {
        Instant now = clock.instant();
        Duration sinceLast = Duration.between(session.lastActivity(), now);
        if (sinceLast.compareTo(properties.getActivityUpdateInterval()) < 0) {
            return session;
        }
        if (store.refreshSession(session.id(), now, session.expiresAt())) {
            return session.withLastActivity(now);
        }
        return session;
    }

    /**
     * 滑动续期：过期时间重置为 now + ttl。
     *
     * @param sessionId 会话 ID。
     * @return 续期后的会话。
     * @throws BusinessException 会话不存在或已过期时抛出 {@link ErrorCode#SESSION_REFRESH_FAILED}。
     */
    public SessionRecord extend(String sessionId) {
        SessionRecord session = resolve(sessionId)
                .orElseThrow(() -> new BusinessException(ErrorCode.SESSION_REFRESH_FAILED));
        Instant now = clock.instant();
        Instant expiresAt = now.plus(properties.getTtl());
        if (!store.refreshSession(sessionId, now, expiresAt)) {
            throw new BusinessException(ErrorCode.SESSION_REFRESH_FAILED);
        }
        return session.withLastActivity(now).withExpiresAt(expiresAt);
    }

    /**
     * 列出用户的活跃会话，按最近活跃时间倒序。
     *
     * @param userId 用户 ID。
     * @return 会话列表。
     */
    public List<SessionRecord> listSessions(long userId) {
        Instant now = clock.instant();
        return store.listSessions(userId).stream()
                .filter(session -> !session.isExpired(now))
                .sorted(Comparator.comparing(SessionRecord::lastActivity).reversed())
                .toList();
    }

    /**
     * 撤销用户自己的某个会话。
     *
     * @param userId    当前用户 ID。
     * @param sessionId 目标会话 ID。
     * @throws BusinessException 会话不存在或不属于该用户时抛出 {@link ErrorCode#SESSION_NOT_FOUND}。
     */
    public void revokeSession(long userId, String sessionId) {
        Optional<SessionRecord> target = store.getSession(sessionId);
        if (target.isEmpty() || target.get().userId() != userId) {
            throw new BusinessException(ErrorCode.SESSION_NOT_FOUND);
        }
        if (store.revokeSession(sessionId)) {
            eventSink.info(SecurityEvents.SESSION_REVOKED, Map.of("userId", userId, "sessionId", sessionId));
        }
    }

    /**
     * 撤销当前会话以外的全部会话。重复调用是安全的，第二次返回 0。
     *
     * @param currentSessionId 当前会话 ID（始终保留）。
     * @param userId           用户 ID。
     * @return 本次撤销的数量。
     */
    public int revokeAllOtherSessions(String currentSessionId, long userId) {
        int revoked = store.revokeSessions(userId, currentSessionId);
        eventSink.info(SecurityEvents.SESSIONS_REVOKED_OTHERS, Map.of(
                "userId", userId,
                "currentSessionId", currentSessionId,
                "revoked", revoked));
        return revoked;
    }

    /**
     * 登出：撤销当前会话。
     *
     * @param sessionId 当前会话 ID。
     */
    public void signOut(String sessionId) {
        if (store.revokeSession(sessionId)) {
            eventSink.info(SecurityEvents.SESSION_SIGNED_OUT, Map.of("sessionId", sessionId));
        }
    }

    /**
     * 清理已过期的会话。
     *
     * @return 删除数量。
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        int removed = store.cleanupExpired(now);
        eventSink.info(SecurityEvents.SESSION_CLEANUP_COMPLETED, Map.of(
                "removed", removed,
                "timestamp", now.toString()));
        return removed;
    }

    /** 会话 Cookie 剩余的有效期（秒级精度，不小于 0）。 */
    public Duration remainingLifetime(SessionRecord session) {
        Duration remaining = Duration.between(clock.instant(), session.expiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    // 超出上限时撤销最久未活跃的会话，刚创建的会话不参与淘汰
    private void trimSessions(long userId, String keepSessionId) {
        List<SessionRecord> sessions = store.listSessions(userId).stream()
                .sorted(Comparator.comparing(SessionRecord::lastActivity).reversed())
                .toList();
        int max = properties.getMaxSessionsPerUser();
        if (sessions.size() <= max) {
            return;
        }
        int kept = 1;
        for (SessionRecord session : sessions) {
            if (session.id().equals(keepSessionId)) {
                continue;
            }
            if (kept < max) {
                kept++;
                continue;
            }
            store.revokeSession(session.id());
            log.info("Session evicted by per-user cap userId={} sessionId={}", userId, session.id());
        }
    }
}
