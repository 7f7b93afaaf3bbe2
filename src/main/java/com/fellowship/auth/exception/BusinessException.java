package com.fellowship.auth.exception;

import lombok.Getter;

/**
 * 业务异常：携带 {@link ErrorCode}，由全局异常处理器转换为 {@code code/message} 响应体。
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
