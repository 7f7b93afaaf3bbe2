package com.fellowship.auth.session.client;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 客户端会话活跃跟踪器。
 * <p>
 * 只维护一个最近活跃时间戳。交互事件经去抖后刷新该时间戳，周期性 {@link #tick()}
 * 计算剩余时间 {@code timeout - (now - lastActivity)}：
 * - 剩余时间进入 (0, warningThreshold] 时提醒，新的活跃把剩余时间拉回阈值之上时撤下提醒；
 * - 剩余时间小于等于 0 时撤下提醒并回调过期，同一次过期只回调一次。
 * 过期后忽略交互事件，只有续期成功才会重新计时。续期失败或异常按过期处理。
 */
@Slf4j
public class SessionActivityTracker implements AutoCloseable {

    private final SessionRemote remote;
    private final SessionTimeoutListener listener;
    private final Clock clock;
    private final TrackerSettings settings;

    private final Object lock = new Object();
    private long lastActivityMillis;
    private boolean warningActive;
    private boolean expired;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public SessionActivityTracker(SessionRemote remote, SessionTimeoutListener listener, Clock clock, TrackerSettings settings) {
        this.remote = remote;
        this.listener = listener;
        this.clock = clock;
        this.settings = settings;
        this.lastActivityMillis = clock.millis();
    }

    public SessionActivityTracker(SessionRemote remote, SessionTimeoutListener listener) {
        this(remote, listener, Clock.systemUTC(), TrackerSettings.defaults());
    }

    /**
     * 按 {@code tickInterval} 启动周期检查。重复调用无效果。
     */
    public void start() {
        synchronized (lock) {
            if (scheduler != null) {
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "session-activity-tracker");
                thread.setDaemon(true);
                return thread;
            });
            long period = settings.tickInterval().toMillis();
            tickTask = scheduler.scheduleAtFixedRate(this::safeTick, period, period, TimeUnit.MILLISECONDS);
        }
    }

    /** 停止周期检查。 */
    public void stop() {
        synchronized (lock) {
            if (tickTask != null) {
                tickTask.cancel(false);
                tickTask = null;
            }
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * 记录一次交互。距上次记录不足去抖间隔、或已过期时忽略。
     *
     * @param kind 交互类型。
     * @return 是否刷新了活跃时间。
     */
    public boolean recordActivity(ActivityKind kind) {
        long now = clock.millis();
        synchronized (lock) {
            if (expired) {
                return false;
            }
            if (now - lastActivityMillis < settings.debounce().toMillis()) {
                return false;
            }
            lastActivityMillis = now;
        }
        log.trace("Session activity recorded kind={}", kind);
        return true;
    }

    /**
     * 执行一次检查，更新提醒与过期状态并触发相应回调。
     */
    public void tick() {
        Duration remaining;
        boolean warn = false;
        boolean dismiss = false;
        boolean expire = false;
        synchronized (lock) {
            if (expired) {
                return;
            }
            remaining = remainingLocked();
            if (remaining.isZero() || remaining.isNegative()) {
                dismiss = warningActive;
                warningActive = false;
                expired = true;
                expire = true;
            } else if (remaining.compareTo(settings.warningThreshold()) <= 0) {
                warningActive = true;
                warn = true;
            } else if (warningActive) {
                warningActive = false;
                dismiss = true;
            }
        }
        if (dismiss) {
            listener.onWarningDismissed();
        }
        if (warn) {
            listener.onWarning(remaining);
        }
        if (expire) {
            listener.onExpired();
        }
    }

    /**
     * 请求服务端续期。成功则重新计时并撤下提醒；失败或异常按过期处理。
     *
     * @return 续期是否成功。
     */
    public CompletableFuture<Boolean> extendSession() {
        CompletableFuture<Boolean> call;
        try {
            call = remote.refresh();
        } catch (RuntimeException ex) {
            call = CompletableFuture.failedFuture(ex);
        }
        return call.handle((success, error) -> {
            if (error == null && Boolean.TRUE.equals(success)) {
                onExtendSucceeded();
                return true;
            }
            if (error != null) {
                log.warn("Session refresh failed", error);
            }
            expire();
            return false;
        });
    }

    /**
     * 登出：无论服务端调用是否成功都回调过期。
     *
     * @return 完成信号。
     */
    public CompletableFuture<Void> signOut() {
        CompletableFuture<Void> call;
        try {
            call = remote.signOut();
        } catch (RuntimeException ex) {
            call = CompletableFuture.failedFuture(ex);
        }
        return call.handle((ignored, error) -> {
            if (error != null) {
                log.warn("Sign-out request failed", error);
            }
            expire();
            return null;
        });
    }

    public Duration remaining() {
        synchronized (lock) {
            return remainingLocked();
        }
    }

    public boolean isWarningActive() {
        synchronized (lock) {
            return warningActive;
        }
    }

    public boolean isExpired() {
        synchronized (lock) {
            return expired;
        }
    }

    private Duration remainingLocked() {
        long idle = clock.millis() - lastActivityMillis;
        return settings.timeout().minusMillis(idle);
    }

    private void onExtendSucceeded() {
        boolean dismiss;
        synchronized (lock) {
            lastActivityMillis = clock.millis();
            dismiss = warningActive;
            warningActive = false;
            expired = false;
        }
        if (dismiss) {
            listener.onWarningDismissed();
        }
        listener.onExtended();
    }

    private void expire() {
        boolean dismiss;
        synchronized (lock) {
            if (expired) {
                return;
            }
            expired = true;
            dismiss = warningActive;
            warningActive = false;
        }
        if (dismiss) {
            listener.onWarningDismissed();
        }
        listener.onExpired();
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException ex) {
            log.error("Session activity tick failed", ex);
        }
    }
}
