package com.fellowship.auth.csrf;

import org.springframework.http.ResponseCookie;

/**
 * CSRF 校验结论。
 *
 * @param verdict     放行、放行并补发 Cookie、拒绝。
 * @param freshCookie 需要补发的令牌 Cookie，仅在 {@link Verdict#ALLOW_WITH_FRESH_COOKIE} 时非空。
 * @param failure     拒绝原因，仅在 {@link Verdict#REJECT} 时非空。
 */
public record CsrfDecision(Verdict verdict, ResponseCookie freshCookie, CsrfFailure failure) {

    public enum Verdict {
        ALLOW,
        ALLOW_WITH_FRESH_COOKIE,
        REJECT
    }

    private static final CsrfDecision ALLOW = new CsrfDecision(Verdict.ALLOW, null, null);

    public static CsrfDecision allow() {
        return ALLOW;
    }

    public static CsrfDecision allowWithFreshCookie(ResponseCookie cookie) {
        return new CsrfDecision(Verdict.ALLOW_WITH_FRESH_COOKIE, cookie, null);
    }

    public static CsrfDecision reject(CsrfFailure failure) {
        return new CsrfDecision(Verdict.REJECT, null, failure);
    }

    public boolean isRejected() {
        return verdict == Verdict.REJECT;
    }
}
