package com.fellowship.auth.exception;

/**
 * 会话/二次验证存储不可用时抛出。
 * <p>
 * 与业务异常区分开，管线据此选择失败即拒绝（fail-closed）的处理，而不是放行请求。
 */
public class SecurityStoreException extends RuntimeException {

    public SecurityStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
