package com.fellowship.auth.session;

import com.fellowship.auth.config.AuthProperties;
import org.springframework.http.ResponseCookie;

import java.time.Duration;

/**
 * 会话相关 Cookie 的构造。
 * <p>
 * - {@code session_id}：HttpOnly、SameSite=Lax，Max-Age 为会话剩余有效期；
 * - {@code 2fa_verified}：二次验证通过后的标记，仅供前端展示，服务端以会话记录为准。
 */
public class SessionCookieFactory {

    private static final String SAME_SITE = "Lax";

    private final AuthProperties.Session session;
    private final AuthProperties.TwoFactor twoFactor;

    public SessionCookieFactory(AuthProperties.Session session, AuthProperties.TwoFactor twoFactor) {
        this.session = session;
        this.twoFactor = twoFactor;
    }

    public String sessionCookieName() {
        return session.getCookieName();
    }

    public ResponseCookie sessionCookie(String sessionId, Duration maxAge) {
        return build(session.getCookieName(), sessionId, maxAge);
    }

    public ResponseCookie clearSessionCookie() {
        return build(session.getCookieName(), "", Duration.ZERO);
    }

    /** 标记 Cookie 的有效期与会话有效期一致。 */
    public ResponseCookie twoFactorMarker() {
        return build(twoFactor.getVerifiedCookieName(), "true", session.getTtl());
    }

    public ResponseCookie clearTwoFactorMarker() {
        return build(twoFactor.getVerifiedCookieName(), "", Duration.ZERO);
    }

    private ResponseCookie build(String name, String value, Duration maxAge) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(session.isSecure())
                .sameSite(SAME_SITE)
                .path("/")
                .maxAge(maxAge)
                .build();
    }
}
