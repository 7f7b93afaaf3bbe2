package com.fellowship.auth.headers;

import com.fellowship.auth.config.AuthProperties;
import com.fellowship.auth.pipeline.RequestContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 安全响应头写入器。
 * <p>
 * 管线对每个结果（放行、拒绝、重定向、存储异常）都会调用一次，
 * 头部写入请求上下文，由过滤器统一落到响应上。
 */
public class SecurityHeadersWriter {

    public static final String CONTENT_SECURITY_POLICY = "Content-Security-Policy";
    public static final String CONTENT_SECURITY_POLICY_REPORT_ONLY = "Content-Security-Policy-Report-Only";

    private static final String PERMISSIONS_POLICY = String.join(", ", List.of(
            "camera=(self)",
            "microphone=(self)",
            "geolocation=(self)",
            "notifications=(self)",
            "push=(self)",
            "accelerometer=()",
            "ambient-light-sensor=()",
            "autoplay=()",
            "battery=()",
            "display-capture=()",
            "document-domain=()",
            "encrypted-media=()",
            "fullscreen=(self)",
            "gyroscope=()",
            "magnetometer=()",
            "midi=()",
            "payment=()",
            "picture-in-picture=()",
            "publickey-credentials-get=(self)",
            "screen-wake-lock=(self)",
            "sync-xhr=()",
            "usb=()",
            "web-share=(self)",
            "xr-spatial-tracking=()"
    ));

    private final AuthProperties.Headers properties;

    public SecurityHeadersWriter(AuthProperties.Headers properties) {
        this.properties = properties;
    }

    public void apply(RequestContext context) {
        String csp = buildContentSecurityPolicy(context.getNonce());
        context.setResponseHeader(properties.isCspReportOnly() ? CONTENT_SECURITY_POLICY_REPORT_ONLY : CONTENT_SECURITY_POLICY, csp);
        if (properties.isHstsEnabled()) {
            context.setResponseHeader("Strict-Transport-Security",
                    "max-age=" + properties.getHstsMaxAge().getSeconds() + "; includeSubDomains; preload");
        }
        context.setResponseHeader("X-XSS-Protection", "1; mode=block");
        context.setResponseHeader("X-Content-Type-Options", "nosniff");
        context.setResponseHeader("Referrer-Policy", "strict-origin-when-cross-origin");
        context.setResponseHeader("Permissions-Policy", PERMISSIONS_POLICY);
        context.setResponseHeader("X-Frame-Options", "DENY");
        context.setResponseHeader("X-DNS-Prefetch-Control", "on");
        context.setResponseHeader("Cross-Origin-Embedder-Policy", "credentialless");
        context.setResponseHeader("Cross-Origin-Opener-Policy", "same-origin");
        context.setResponseHeader("Cross-Origin-Resource-Policy", "same-origin");
    }

    /**
     * 构造 CSP。脚本只允许同源与携带本次请求 nonce 的内联脚本。
     *
     * @param nonce 本次请求的 nonce，可为 null。
     * @return CSP 头部值。
     */
    public String buildContentSecurityPolicy(String nonce) {
        Map<String, String> directives = new LinkedHashMap<>();
        directives.put("default-src", "'self'");
        directives.put("script-src", nonce == null ? "'self'" : "'self' 'nonce-" + nonce + "'");
        directives.put("style-src", "'self' 'unsafe-inline'");
        directives.put("font-src", "'self' data:");
        directives.put("img-src", "'self' data: blob: https:");
        directives.put("media-src", "'self' https: blob:");
        directives.put("connect-src", "'self' https: wss:");
        directives.put("frame-src", "'self'");
        directives.put("worker-src", "'self' blob:");
        directives.put("manifest-src", "'self'");
        directives.put("base-uri", "'self'");
        directives.put("form-action", "'self'");
        directives.put("frame-ancestors", "'none'");
        directives.put("object-src", "'none'");
        directives.put("upgrade-insecure-requests", "");
        directives.put("report-uri", properties.getCspReportUri());
        return directives.entrySet().stream()
                .map(entry -> entry.getValue().isEmpty() ? entry.getKey() : entry.getKey() + " " + entry.getValue())
                .collect(Collectors.joining("; "));
    }
}
