package com.fellowship.auth.model;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 客户端信息。
 * <p>
 * 记录客户端 IP 与 User-Agent，用于会话的设备描述与安全事件记录。
 *
 * @param ip        客户端 IP 地址（可能来自 `X-Forwarded-For` 或远端地址）。
 * @param userAgent 客户端 User-Agent 字符串。
 */
public record ClientInfo(String ip, String userAgent) {

    /**
     * 从请求中解析客户端信息。
     * <p>
     * IP 优先使用代理头：`X-Forwarded-For`（取第一个）、`X-Real-IP`；否则回退到 `request.getRemoteAddr()`。
     *
     * @param request HTTP 请求对象。
     * @return 客户端信息。
     */
    public static ClientInfo from(HttpServletRequest request) {
        return new ClientInfo(extractClientIp(request), request.getHeader("User-Agent"));
    }

    private static String extractClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }
}
