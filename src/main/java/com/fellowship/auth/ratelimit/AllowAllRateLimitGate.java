package com.fellowship.auth.ratelimit;

/**
 * 默认限流闸门：全部放行。部署时以真实实现的 Bean 覆盖。
 */
public class AllowAllRateLimitGate implements RateLimitGate {

    @Override
    public boolean tryAcquire(String key) {
        return true;
    }
}
