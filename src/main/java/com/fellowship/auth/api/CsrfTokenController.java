package com.fellowship.auth.api;

import com.fellowship.auth.api.dto.CsrfTokenResponse;
import com.fellowship.auth.csrf.CsrfGuard;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.WebUtils;

/**
 * CSRF 令牌签发接口（豁免路由，不经过 CSRF 校验）。
 * <p>
 * 已有有效令牌时原样返回，否则签发新令牌并写入 Cookie。
 */
@RestController
@RequiredArgsConstructor
public class CsrfTokenController {

    private final CsrfGuard csrfGuard;

    @GetMapping("/api/csrf-token")
    public ResponseEntity<CsrfTokenResponse> token(HttpServletRequest request) {
        Cookie existing = WebUtils.getCookie(request, csrfGuard.cookieName());
        String current = existing == null ? null : existing.getValue();
        String token = csrfGuard.tokenForClient(current);
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok().cacheControl(CacheControl.noStore());
        if (!token.equals(current)) {
            builder.header(HttpHeaders.SET_COOKIE, csrfGuard.cookieFor(token).toString());
        }
        return builder.body(new CsrfTokenResponse(token));
    }
}
