package com.fellowship.auth.route;

/**
 * 路由分类。
 */
public enum RouteClass {
    /** 认证入口、静态资源与管线自身的令牌接口：不进入 CSRF 与二次验证检查。 */
    EXEMPT,
    /** 敏感路径：需要二次验证。 */
    REQUIRES_TWO_FACTOR,
    /** 其余路径。 */
    STANDARD
}
