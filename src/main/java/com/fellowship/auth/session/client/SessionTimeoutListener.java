package com.fellowship.auth.session.client;

import java.time.Duration;

/**
 * 会话超时状态回调。默认实现为空，按需覆盖。
 */
public interface SessionTimeoutListener {

    /** 剩余时间进入提醒阈值，每次 tick 都会带上最新剩余时间。 */
    default void onWarning(Duration remaining) {
    }

    /** 提醒被撤下（有新的活跃、续期成功或已过期）。 */
    default void onWarningDismissed() {
    }

    /** 会话过期，每次过期只回调一次。 */
    default void onExpired() {
    }

    /** 续期成功。 */
    default void onExtended() {
    }
}
