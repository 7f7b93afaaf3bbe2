package com.fellowship.auth.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    UNAUTHENTICATED("UNAUTHENTICATED", "请先登录", HttpStatus.UNAUTHORIZED),
    CSRF_MISSING("CSRF_MISSING", "缺少 CSRF 令牌", HttpStatus.FORBIDDEN),
    CSRF_INVALID("CSRF_INVALID", "CSRF 令牌无效或已过期", HttpStatus.FORBIDDEN),
    SESSION_NOT_FOUND("SESSION_NOT_FOUND", "会话不存在或已失效", HttpStatus.NOT_FOUND),
    SESSION_REFRESH_FAILED("SESSION_REFRESH_FAILED", "会话续期失败，请重新登录", HttpStatus.UNAUTHORIZED),
    TWO_FACTOR_ALREADY_ENABLED("TWO_FACTOR_ALREADY_ENABLED", "已开启二次验证", HttpStatus.CONFLICT),
    TWO_FACTOR_NOT_ENABLED("TWO_FACTOR_NOT_ENABLED", "未开启二次验证", HttpStatus.BAD_REQUEST),
    TWO_FACTOR_SETUP_NOT_FOUND("TWO_FACTOR_SETUP_NOT_FOUND", "未找到待确认的二次验证设置", HttpStatus.BAD_REQUEST),
    TWO_FACTOR_CODE_INVALID("TWO_FACTOR_CODE_INVALID", "验证码错误", HttpStatus.BAD_REQUEST),
    RATE_LIMITED("RATE_LIMITED", "请求过于频繁", HttpStatus.TOO_MANY_REQUESTS),
    CSP_REPORT_INVALID("CSP_REPORT_INVALID", "CSP 违规报告格式错误", HttpStatus.BAD_REQUEST),
    CRON_UNAUTHORIZED("CRON_UNAUTHORIZED", "定时任务凭证无效", HttpStatus.UNAUTHORIZED),
    SECURITY_STORE_UNAVAILABLE("SECURITY_STORE_UNAVAILABLE", "安全存储暂不可用，请稍后重试", HttpStatus.SERVICE_UNAVAILABLE),
    NOT_FOUND("NOT_FOUND", "资源不存在", HttpStatus.NOT_FOUND),
    BAD_REQUEST("BAD_REQUEST", "请求参数错误", HttpStatus.BAD_REQUEST),
    INTERNAL_ERROR("INTERNAL_ERROR", "服务器内部错误", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus status;

    ErrorCode(String code, String defaultMessage, HttpStatus status) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.status = status;
    }
}
