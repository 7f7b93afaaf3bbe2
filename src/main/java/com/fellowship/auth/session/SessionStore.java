package com.fellowship.auth.session;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 会话存储接口。
 * <p>
 * 实现需保证撤销是单条原子命令（同一会话只会被成功撤销一次），
 * 并在后端不可用时抛出 {@link com.fellowship.auth.exception.SecurityStoreException}。
 */
public interface SessionStore {

    void saveSession(SessionRecord session);

    Optional<SessionRecord> getSession(String sessionId);

    /**
     * 更新最近活跃时间与过期时间；会话已不存在时不做任何事。
     *
     * @return 是否更新成功。
     */
    boolean refreshSession(String sessionId, Instant lastActivity, Instant expiresAt);

    /**
     * 将会话标记为已通过二次验证。
     *
     * @return 会话存在并已标记时返回 true。
     */
    boolean markTwoFactorVerified(String sessionId);

    /** 列出用户的全部会话（含可能已过期、尚未清理的记录）。 */
    List<SessionRecord> listSessions(long userId);

    /**
     * 撤销单个会话。
     *
     * @return 本次调用实际删除了会话时返回 true。
     */
    boolean revokeSession(String sessionId);

    /**
     * 撤销用户除 {@code exceptSessionId} 以外的全部会话。
     *
     * @return 实际撤销的数量。
     */
    int revokeSessions(long userId, String exceptSessionId);

    /**
     * 删除过期时间早于等于 {@code now} 的会话。
     *
     * @return 删除数量。
     */
    int cleanupExpired(Instant now);
}
