package com.fellowship.auth.csrf;

import com.fellowship.auth.exception.ErrorCode;
import lombok.Getter;

/**
 * CSRF 拒绝原因：缺少令牌或令牌无效（签名不符、已过期、格式错误）。
 */
@Getter
public enum CsrfFailure {
    MISSING("missing", ErrorCode.CSRF_MISSING),
    INVALID("invalid", ErrorCode.CSRF_INVALID);

    private final String reason;
    private final ErrorCode errorCode;

    CsrfFailure(String reason, ErrorCode errorCode) {
        this.reason = reason;
        this.errorCode = errorCode;
    }
}
