package com.fellowship.auth.api;

import com.fellowship.auth.api.dto.SessionRefreshResponse;
import com.fellowship.auth.pipeline.SessionPrincipal;
import com.fellowship.auth.session.SessionCookieFactory;
import com.fellowship.auth.session.SessionLifecycleService;
import com.fellowship.auth.session.SessionRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 当前会话接口：续期与登出。
 * <p>
 * 登录本身（凭证交换）不在本服务内，外部登录流程完成后调用
 * {@link SessionLifecycleService#createSession} 建立会话。
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final SessionLifecycleService sessionLifecycleService;
    private final SessionCookieFactory cookieFactory;

    /**
     * 滑动续期当前会话并续发 Cookie。
     *
     * @param principal 当前会话身份。
     * @return 会话 ID 与新的过期时间。
     */
    @PostMapping("/session/refresh")
    public ResponseEntity<SessionRefreshResponse> refresh(@AuthenticationPrincipal SessionPrincipal principal) {
        SessionRecord session = sessionLifecycleService.extend(principal.sessionId());
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookieFactory
                        .sessionCookie(session.id(), sessionLifecycleService.remainingLifetime(session)).toString())
                .body(new SessionRefreshResponse(session.id(), session.expiresAt()));
    }

    /**
     * 登出：撤销当前会话并清除会话与二次验证标记 Cookie。
     */
    @PostMapping("/sign-out")
    public ResponseEntity<Void> signOut(@AuthenticationPrincipal SessionPrincipal principal) {
        sessionLifecycleService.signOut(principal.sessionId());
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.clearSessionCookie().toString())
                .header(HttpHeaders.SET_COOKIE, cookieFactory.clearTwoFactorMarker().toString())
                .build();
    }
}
