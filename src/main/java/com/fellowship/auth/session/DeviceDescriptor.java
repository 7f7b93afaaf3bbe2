package com.fellowship.auth.session;

import java.util.regex.Pattern;

/**
 * 由 User-Agent 粗略推断设备描述，仅用于会话列表展示。
 */
public final class DeviceDescriptor {

    private static final Pattern MOBILE = Pattern.compile("Mobile|Android|iPhone|iPad");

    private DeviceDescriptor() {
    }

    public static String describe(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return "Unknown Device";
        }
        if (MOBILE.matcher(userAgent).find()) {
            if (userAgent.contains("iPhone")) {
                return "iPhone";
            }
            if (userAgent.contains("iPad")) {
                return "iPad";
            }
            if (userAgent.contains("Android")) {
                return "Android Device";
            }
            return "Mobile Device";
        }
        if (userAgent.contains("Windows")) {
            return "Windows Computer";
        }
        if (userAgent.contains("Mac")) {
            return "Mac Computer";
        }
        if (userAgent.contains("Linux")) {
            return "Linux Computer";
        }
        return "Unknown Device";
    }
}
