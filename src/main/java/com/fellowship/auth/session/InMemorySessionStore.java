package com.fellowship.auth.session;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 {@link ConcurrentHashMap} 的非持久化会话存储。
 * <p>
 * 条件更新使用 {@code computeIfPresent}，撤销使用 {@code remove}，与 Redis 实现保持相同的原子语义。
 * 重启即丢失全部会话，仅用于本地开发与集成测试。
 */
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private final ConcurrentHashMap<String, SessionRecord> sessions = new ConcurrentHashMap<>();
    // 反向索引：userId -> 会话 ID 集合，与 sessions 同步维护
    private final ConcurrentHashMap<Long, Set<String>> userIndex = new ConcurrentHashMap<>();

    @Override
    public void saveSession(SessionRecord session) {
        sessions.put(session.id(), session);
        userIndex.computeIfAbsent(session.userId(), k -> ConcurrentHashMap.newKeySet()).add(session.id());
        log.debug("Stored session sessionId={} userId={}", session.id(), session.userId());
    }

    @Override
    public Optional<SessionRecord> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public boolean refreshSession(String sessionId, Instant lastActivity, Instant expiresAt) {
        SessionRecord updated = sessions.computeIfPresent(sessionId,
                (id, current) -> current.withLastActivity(lastActivity).withExpiresAt(expiresAt));
        return updated != null;
    }

    @Override
    public boolean markTwoFactorVerified(String sessionId) {
        return sessions.computeIfPresent(sessionId, (id, current) -> current.withTwoFactorVerified(true)) != null;
    }

    @Override
    public List<SessionRecord> listSessions(long userId) {
        Set<String> ids = userIndex.get(userId);
        List<SessionRecord> result = new ArrayList<>();
        if (ids == null) {
            return result;
        }
        for (String id : ids) {
            SessionRecord session = sessions.get(id);
            if (session != null) {
                result.add(session);
            }
        }
        return result;
    }

    @Override
    public boolean revokeSession(String sessionId) {
        SessionRecord removed = sessions.remove(sessionId);
        if (removed == null) {
            return false;
        }
        unindex(removed);
        log.debug("Revoked session sessionId={}", sessionId);
        return true;
    }

    @Override
    public int revokeSessions(long userId, String exceptSessionId) {
        Set<String> ids = userIndex.get(userId);
        if (ids == null) {
            return 0;
        }
        int revoked = 0;
        for (String id : List.copyOf(ids)) {
            if (!id.equals(exceptSessionId) && revokeSession(id)) {
                revoked++;
            }
        }
        return revoked;
    }

    @Override
    public int cleanupExpired(Instant now) {
        int removed = 0;
        for (SessionRecord candidate : List.copyOf(sessions.values())) {
            if (!candidate.isExpired(now)) {
                continue;
            }
            // 仅当记录仍是扫描时看到的过期版本时删除，期间被续期的会话保留
            if (sessions.remove(candidate.id(), candidate)) {
                unindex(candidate);
                removed++;
            } else {
                SessionRecord latest = sessions.get(candidate.id());
                if (latest != null && latest.isExpired(now) && revokeSession(candidate.id())) {
                    removed++;
                }
            }
        }
        return removed;
    }

    private void unindex(SessionRecord session) {
        Set<String> ids = userIndex.get(session.userId());
        if (ids != null) {
            ids.remove(session.id());
        }
    }
}
