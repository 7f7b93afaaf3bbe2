package com.fellowship.auth.ratelimit;

/**
 * 限流闸门。
 * <p>
 * 计数算法与存储不在本服务内实现，调用方只关心是否放行。
 */
public interface RateLimitGate {

    /**
     * 尝试获取一次许可。
     *
     * @param key 限流键（如 {@code 2fa:verify:{userId}}）。
     * @return 是否放行。
     */
    boolean tryAcquire(String key);
}
