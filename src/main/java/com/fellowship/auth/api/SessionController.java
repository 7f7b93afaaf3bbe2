package com.fellowship.auth.api;

import com.fellowship.auth.api.dto.RevokeOthersResponse;
import com.fellowship.auth.api.dto.RevokeSessionRequest;
import com.fellowship.auth.api.dto.SessionListResponse;
import com.fellowship.auth.api.dto.SessionResponse;
import com.fellowship.auth.exception.BusinessException;
import com.fellowship.auth.exception.ErrorCode;
import com.fellowship.auth.pipeline.SessionPrincipal;
import com.fellowship.auth.ratelimit.RateLimitGate;
import com.fellowship.auth.session.SessionCookieFactory;
import com.fellowship.auth.session.SessionLifecycleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 会话管理接口。
 * <p>
 * 列出当前用户的活跃会话、撤销单个会话、撤销除当前会话外的全部会话。
 * 这些路由属于需要二次验证的路由，由安全管线先行把关。
 */
@RestController
@RequestMapping("/api/v1/auth/sessions")
@RequiredArgsConstructor
@Validated
public class SessionController {

    private final SessionLifecycleService sessionLifecycleService;
    private final SessionCookieFactory cookieFactory;
    private final RateLimitGate rateLimitGate;

    /**
     * 列出活跃会话，按最近活跃时间倒序，标记当前会话。
     *
     * @param principal 当前会话身份。
     * @return 会话列表。
     */
    @GetMapping
    public SessionListResponse list(@AuthenticationPrincipal SessionPrincipal principal) {
        return new SessionListResponse(sessionLifecycleService.listSessions(principal.userId()).stream()
                .map(session -> SessionResponse.from(session, principal.sessionId()))
                .toList());
    }

    /**
     * 撤销单个会话；撤销的是当前会话时同时清除 Cookie。
     */
    @PostMapping("/revoke")
    public ResponseEntity<Void> revoke(@AuthenticationPrincipal SessionPrincipal principal,
                                       @Valid @RequestBody RevokeSessionRequest request) {
        requirePermit("session:revoke:" + principal.userId());
        sessionLifecycleService.revokeSession(principal.userId(), request.sessionId());
        ResponseEntity.HeadersBuilder<?> builder = ResponseEntity.noContent();
        if (request.sessionId().equals(principal.sessionId())) {
            builder.header(HttpHeaders.SET_COOKIE, cookieFactory.clearSessionCookie().toString());
        }
        return builder.build();
    }

    /**
     * 撤销除当前会话外的全部会话，重复调用返回 0。
     */
    @PostMapping("/revoke-others")
    public RevokeOthersResponse revokeOthers(@AuthenticationPrincipal SessionPrincipal principal) {
        requirePermit("session:revoke:" + principal.userId());
        return new RevokeOthersResponse(
                sessionLifecycleService.revokeAllOtherSessions(principal.sessionId(), principal.userId()));
    }

    private void requirePermit(String key) {
        if (!rateLimitGate.tryAcquire(key)) {
            throw new BusinessException(ErrorCode.RATE_LIMITED);
        }
    }
}
