package com.fellowship.auth.api;

import com.fellowship.auth.api.dto.CleanupResponse;
import com.fellowship.auth.config.AuthProperties;
import com.fellowship.auth.exception.BusinessException;
import com.fellowship.auth.exception.ErrorCode;
import com.fellowship.auth.session.SessionLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;

/**
 * 外部定时任务触发的过期会话清理（豁免路由，凭 Bearer 密钥访问）。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SessionCleanupController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionLifecycleService sessionLifecycleService;
    private final AuthProperties properties;
    private final Clock clock;

    @RequestMapping(value = "/api/cron/cleanup-sessions", method = {RequestMethod.GET, RequestMethod.POST})
    public CleanupResponse cleanup(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        if (!authorized(authorization)) {
            log.warn("Rejected session cleanup trigger with invalid credentials");
            throw new BusinessException(ErrorCode.CRON_UNAUTHORIZED);
        }
        int removed = sessionLifecycleService.cleanupExpired();
        return new CleanupResponse(true, removed, clock.instant());
    }

    // 未配置密钥时始终拒绝
    private boolean authorized(String authorization) {
        String secret = properties.getSession().getCronSecret();
        if (secret == null || secret.isBlank() || authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return false;
        }
        byte[] expected = secret.getBytes(StandardCharsets.UTF_8);
        byte[] actual = authorization.substring(BEARER_PREFIX.length()).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, actual);
    }
}
