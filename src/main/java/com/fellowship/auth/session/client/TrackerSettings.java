package com.fellowship.auth.session.client;

import java.time.Duration;

/**
 * 客户端会话跟踪参数。
 *
 * @param timeout          无活跃多久后视为过期。
 * @param warningThreshold 剩余时间小于等于该值时提醒。
 * @param debounce         两次活跃记录的最小间隔。
 * @param tickInterval     检查周期。
 */
public record TrackerSettings(Duration timeout, Duration warningThreshold, Duration debounce, Duration tickInterval) {

    public TrackerSettings {
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (warningThreshold.isNegative() || warningThreshold.compareTo(timeout) >= 0) {
            throw new IllegalArgumentException("warningThreshold must be in [0, timeout)");
        }
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
    }

    /** 30 分钟超时，剩余 5 分钟时提醒，每秒检查。 */
    public static TrackerSettings defaults() {
        return new TrackerSettings(Duration.ofMinutes(30), Duration.ofMinutes(5), Duration.ofSeconds(1), Duration.ofSeconds(1));
    }
}
