package com.fellowship.auth.api;

import com.fellowship.auth.api.dto.BackupCodesResponse;
import com.fellowship.auth.api.dto.TwoFactorCodeRequest;
import com.fellowship.auth.api.dto.TwoFactorSetupResponse;
import com.fellowship.auth.api.dto.TwoFactorStatusResponse;
import com.fellowship.auth.api.dto.TwoFactorVerifyResponse;
import com.fellowship.auth.exception.BusinessException;
import com.fellowship.auth.exception.ErrorCode;
import com.fellowship.auth.pipeline.SessionPrincipal;
import com.fellowship.auth.ratelimit.RateLimitGate;
import com.fellowship.auth.session.SessionCookieFactory;
import com.fellowship.auth.twofactor.TwoFactorService;
import com.fellowship.auth.twofactor.TwoFactorSetup;
import com.fellowship.auth.twofactor.TwoFactorStatus;
import com.fellowship.auth.twofactor.TwoFactorVerifyResult;
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
 * 二次验证接口。
 * <p>
 * 设置与开启、挑战页提交验证、关闭、重新生成备用码、查询状态。
 * 验证类接口在执行前先经过限流闸门。
 */
@RestController
@RequestMapping("/api/v1/auth/2fa")
@RequiredArgsConstructor
@Validated
public class TwoFactorController {

    private final TwoFactorService twoFactorService;
    private final SessionCookieFactory cookieFactory;
    private final RateLimitGate rateLimitGate;

    /**
     * 发起设置：返回密钥、provisioning 地址与备用码，等待 {@code /enable} 确认。
     */
    @PostMapping("/setup")
    public TwoFactorSetupResponse setup(@AuthenticationPrincipal SessionPrincipal principal) {
        TwoFactorSetup setup = twoFactorService.setup(principal.userId(), principal.sessionId(), "user-" + principal.userId());
        return new TwoFactorSetupResponse(setup.secret(), setup.provisioningUri(), setup.backupCodes());
    }

    /**
     * 用动态码确认设置并开启，当前会话随即视为已验证。
     */
    @PostMapping("/enable")
    public ResponseEntity<Void> enable(@AuthenticationPrincipal SessionPrincipal principal,
                                       @Valid @RequestBody TwoFactorCodeRequest request) {
        requirePermit("2fa:verify:" + principal.userId());
        twoFactorService.enable(principal.userId(), principal.sessionId(), request.code());
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.twoFactorMarker().toString())
                .build();
    }

    /**
     * 挑战页提交：动态码或备用码，通过后标记当前会话。
     */
    @PostMapping("/verify")
    public ResponseEntity<TwoFactorVerifyResponse> verify(@AuthenticationPrincipal SessionPrincipal principal,
                                                          @Valid @RequestBody TwoFactorCodeRequest request) {
        requirePermit("2fa:verify:" + principal.userId());
        TwoFactorVerifyResult result = twoFactorService.verify(principal.userId(), principal.sessionId(), request.code());
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.twoFactorMarker().toString())
                .body(new TwoFactorVerifyResponse(result.method().name(), result.backupCodesRemaining()));
    }

    /**
     * 关闭二次验证。
     */
    @PostMapping("/disable")
    public ResponseEntity<Void> disable(@AuthenticationPrincipal SessionPrincipal principal,
                                        @Valid @RequestBody TwoFactorCodeRequest request) {
        requirePermit("2fa:verify:" + principal.userId());
        twoFactorService.disable(principal.userId(), request.code());
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.clearTwoFactorMarker().toString())
                .build();
    }

    /**
     * 重新生成备用码，旧备用码全部失效。
     */
    @PostMapping("/backup-codes")
    public BackupCodesResponse regenerateBackupCodes(@AuthenticationPrincipal SessionPrincipal principal,
                                                     @Valid @RequestBody TwoFactorCodeRequest request) {
        requirePermit("2fa:verify:" + principal.userId());
        return new BackupCodesResponse(twoFactorService.regenerateBackupCodes(principal.userId(), request.code()));
    }

    @GetMapping("/status")
    public TwoFactorStatusResponse status(@AuthenticationPrincipal SessionPrincipal principal) {
        TwoFactorStatus status = twoFactorService.status(principal.userId());
        return new TwoFactorStatusResponse(status.enabled(), status.backupCodesRemaining(), principal.twoFactorVerified());
    }

    private void requirePermit(String key) {
        if (!rateLimitGate.tryAcquire(key)) {
            throw new BusinessException(ErrorCode.RATE_LIMITED);
        }
    }
}
