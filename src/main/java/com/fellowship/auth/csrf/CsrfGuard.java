package com.fellowship.auth.csrf;

import com.fellowship.auth.config.AuthProperties;
import com.fellowship.auth.pipeline.RequestContext;
import com.fellowship.auth.route.RouteClass;
import com.fellowship.auth.route.RouteClassifier;
import com.fellowship.auth.token.TokenCodec;
import com.fellowship.auth.token.TokenStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseCookie;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 双重提交 CSRF 防护。
 * <p>
 * - 豁免路由直接放行；
 * - 安全方法放行，Cookie 缺失或失效时补发新令牌；
 * - 其余方法要求请求头（或表单字段）与 Cookie 中都带有各自有效的令牌。
 * 令牌的合法性完全由 {@link TokenCodec} 的签名与时效决定，服务端不保存令牌。
 */
@Slf4j
public class CsrfGuard {

    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");

    private final TokenCodec codec;
    private final AuthProperties.Csrf properties;
    private final RouteClassifier routeClassifier;

    public CsrfGuard(TokenCodec codec, AuthProperties.Csrf properties, RouteClassifier routeClassifier) {
        this.codec = codec;
        this.properties = properties;
        this.routeClassifier = routeClassifier;
    }

    /**
     * 校验一次请求。
     *
     * @param context 请求上下文。
     * @return 放行、放行并补发 Cookie、或带原因的拒绝。
     */
    public CsrfDecision protect(RequestContext context) {
        if (routeClassifier.classify(context.getMethod(), context.getPath()) == RouteClass.EXEMPT) {
            return CsrfDecision.allow();
        }
        Optional<String> cookieToken = context.cookie(properties.getCookieName());
        if (isSafeMethod(context.getMethod())) {
            if (cookieToken.map(codec::isValid).orElse(false)) {
                return CsrfDecision.allow();
            }
            return CsrfDecision.allowWithFreshCookie(cookieFor(codec.issue()));
        }

        Optional<String> submitted = context.header(properties.getHeaderName())
                .or(() -> context.formParameter(properties.getFormField()))
                .filter(token -> !token.isBlank());
        if (submitted.isEmpty()) {
            return reject(context, CsrfFailure.MISSING, "request token absent");
        }
        TokenStatus submittedStatus = codec.verify(submitted.get());
        if (!submittedStatus.isValid()) {
            return reject(context, CsrfFailure.INVALID, "request token " + submittedStatus);
        }
        if (cookieToken.isEmpty() || cookieToken.get().isBlank()) {
            return reject(context, CsrfFailure.MISSING, "cookie token absent");
        }
        TokenStatus cookieStatus = codec.verify(cookieToken.get());
        if (!cookieStatus.isValid()) {
            return reject(context, CsrfFailure.INVALID, "cookie token " + cookieStatus);
        }
        if (properties.isRequireMatchingCookie() && !submitted.get().equals(cookieToken.get())) {
            return reject(context, CsrfFailure.INVALID, "cookie and request token differ");
        }
        return CsrfDecision.allow();
    }

    /**
     * 为客户端提供可用的令牌：已有且有效的 Cookie 令牌原样返回，否则签发新令牌。
     *
     * @param existingCookieToken 请求中已有的 Cookie 令牌，可为 null。
     * @return 令牌字符串。
     */
    public String tokenForClient(String existingCookieToken) {
        if (existingCookieToken != null && codec.isValid(existingCookieToken)) {
            return existingCookieToken;
        }
        return codec.issue();
    }

    /**
     * 构造携带令牌的 Cookie。前端脚本需要读取令牌并回填到请求头，因此不设置 HttpOnly。
     *
     * @param token 令牌。
     * @return Cookie。
     */
    public ResponseCookie cookieFor(String token) {
        return ResponseCookie.from(properties.getCookieName(), token)
                .httpOnly(false)
                .secure(properties.isSecure())
                .sameSite(properties.getSameSite())
                .path("/")
                .maxAge(properties.getMaxAge())
                .build();
    }

    public String cookieName() {
        return properties.getCookieName();
    }

    private static boolean isSafeMethod(String method) {
        return method != null && SAFE_METHODS.contains(method.toUpperCase(Locale.ROOT));
    }

    private static CsrfDecision reject(RequestContext context, CsrfFailure failure, String detail) {
        log.warn("CSRF check failed method={} path={} reason={} detail={} ip={}",
                context.getMethod(), context.getPath(), failure.getReason(), detail, context.getClient().ip());
        return CsrfDecision.reject(failure);
    }
}
