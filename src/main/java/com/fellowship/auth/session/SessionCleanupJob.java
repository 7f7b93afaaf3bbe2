package com.fellowship.auth.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * 定时清理过期会话。
 * <p>
 * 与 {@code /api/cron/cleanup-sessions} 共用 {@link SessionLifecycleService#cleanupExpired()}，
 * 重复执行是安全的。
 */
@Slf4j
@RequiredArgsConstructor
public class SessionCleanupJob {

    private final SessionLifecycleService sessionLifecycleService;

    @Scheduled(fixedDelayString = "${auth.session.cleanup-interval:PT1H}",
            initialDelayString = "${auth.session.cleanup-interval:PT1H}")
    public void cleanupExpiredSessions() {
        try {
            int removed = sessionLifecycleService.cleanupExpired();
            log.info("Scheduled session cleanup finished removed={}", removed);
        } catch (RuntimeException ex) {
            log.error("Scheduled session cleanup failed", ex);
        }
    }
}
