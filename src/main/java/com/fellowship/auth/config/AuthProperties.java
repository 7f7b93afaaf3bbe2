package com.fellowship.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 安全管线配置属性，绑定前缀 {@code auth.*}。
 *
 * <p>包含以下分组：</p>
 * - Csrf：CSRF 令牌签发、Cookie 与校验配置；
 * - Session：会话有效期、活跃度刷新与过期清理配置；
 * - TwoFactor：二次验证挑战页、TOTP 参数与备用码配置；
 * - Headers：安全响应头配置；
 * - Routes：路由分类表（豁免前缀与需二次验证前缀）；
 * - Store：会话/二次验证存储实现选择。
 */
@Data
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    /** CSRF 配置项。 */
    private final Csrf csrf = new Csrf();
    /** 会话配置项。 */
    private final Session session = new Session();
    /** 二次验证配置项。 */
    private final TwoFactor twoFactor = new TwoFactor();
    /** 安全响应头配置项。 */
    private final Headers headers = new Headers();
    /** 路由分类配置项。 */
    private final Routes routes = new Routes();
    /** 存储配置项。 */
    private final Store store = new Store();

    @Data
    public static class Csrf {
        /** 服务端签名密钥；为空时启动期随机生成（多实例部署必须显式配置）。 */
        private String secret;
        /** 令牌最大有效期，同时作为 Cookie 的 Max-Age。 */
        private Duration maxAge = Duration.ofMinutes(30);
        /** CSRF Cookie 名称。 */
        private String cookieName = "csrf-token";
        /** 携带令牌的请求头名称。 */
        private String headerName = "X-CSRF-Token";
        /** 表单提交时携带令牌的字段名。 */
        private String formField = "csrf_token";
        /** Cookie 的 SameSite 属性。 */
        private String sameSite = "Lax";
        /** Cookie 是否仅在 HTTPS 下发送。 */
        private boolean secure = false;
        /** 是否要求 Cookie 与请求头中的令牌逐字节一致。 */
        private boolean requireMatchingCookie = false;
    }

    /**
     * 会话配置：Cookie、有效期、每用户会话上限、活跃度刷新间隔与清理任务。
     */
    @Data
    public static class Session {
        /** 会话 Cookie 名称。 */
        private String cookieName = "session_id";
        /** 会话有效期（自创建或续期起算）。 */
        private Duration ttl = Duration.ofDays(30);
        /** 每个用户保留的最多活跃会话数。 */
        private int maxSessionsPerUser = 10;
        /** 最近活跃时间的最小更新间隔。 */
        private Duration activityUpdateInterval = Duration.ofMinutes(1);
        /** 过期会话清理任务的执行间隔。 */
        private Duration cleanupInterval = Duration.ofHours(1);
        /** 定时清理接口的 Bearer 密钥；为空时该接口始终拒绝。 */
        private String cronSecret;
        /** Cookie 是否仅在 HTTPS 下发送。 */
        private boolean secure = false;
    }

    /**
     * 二次验证配置：挑战页、回跳参数、标记 Cookie 与 TOTP/备用码参数。
     */
    @Data
    public static class TwoFactor {
        /** 未验证时重定向的挑战页路径。 */
        private String challengePath = "/auth/2fa-verify";
        /** 保存原始目标地址的查询参数名。 */
        private String returnToParam = "redirect";
        /** 验证通过后写入的标记 Cookie 名称。 */
        private String verifiedCookieName = "2fa_verified";
        /** TOTP 发行方名称（显示在验证器应用中）。 */
        private String issuer = "Fellowship";
        /** TOTP 时间步长。 */
        private Duration period = Duration.ofSeconds(30);
        /** TOTP 位数。 */
        private int digits = 6;
        /** 允许的时钟偏移步数（±N）。 */
        private int skewSteps = 1;
        /** 每次生成的备用码数量。 */
        private int backupCodeCount = 10;
        /** 待确认的开启挑战有效期。 */
        private Duration pendingTtl = Duration.ofMinutes(10);
    }

    /** 安全响应头配置。 */
    @Data
    public static class Headers {
        /** 是否下发 HSTS（仅应在 HTTPS 部署开启）。 */
        private boolean hstsEnabled = false;
        /** HSTS max-age。 */
        private Duration hstsMaxAge = Duration.ofDays(365);
        /** 以 Report-Only 方式下发 CSP。 */
        private boolean cspReportOnly = false;
        /** CSP 违规上报地址。 */
        private String cspReportUri = "/api/security/csp-report";
    }

    /** 路由分类表。 */
    @Data
    public static class Routes {
        /** 不进入 CSRF 与二次验证检查的路径前缀。 */
        private List<String> exemptPrefixes = new ArrayList<>(List.of(
                "/auth/",
                "/api/auth/callback",
                "/api/csrf-token",
                "/api/cron/",
                "/api/webhooks/",
                "/api/health",
                "/api/security/csp-report",
                "/actuator/health",
                "/static/",
                "/assets/",
                "/favicon.ico",
                "/sw.js",
                "/manifest.json"
        ));
        /** 视为静态资源的文件扩展名。 */
        private List<String> staticExtensions = new ArrayList<>(List.of(
                ".svg", ".png", ".jpg", ".jpeg", ".gif", ".webp", ".ico", ".css", ".js", ".map", ".woff2"
        ));
        /** 需要二次验证的路径前缀。 */
        private List<String> twoFactorPrefixes = new ArrayList<>(List.of(
                "/settings",
                "/admin",
                "/profile/edit",
                "/api/admin",
                "/api/user/sensitive",
                "/api/v1/auth/sessions"
        ));
    }

    @Data
    public static class Store {
        /** 存储实现：redis 或 memory。 */
        private StoreType type = StoreType.REDIS;
    }

    public enum StoreType {
        REDIS,
        MEMORY
    }
}
