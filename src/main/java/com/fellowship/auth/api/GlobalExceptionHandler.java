package com.fellowship.auth.api;

import com.fellowship.auth.exception.BusinessException;
import com.fellowship.auth.exception.ErrorCode;
import com.fellowship.auth.exception.SecurityStoreException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 业务异常统一返回：HTTP 状态取自错误码。
     *
     * @param ex 业务异常，包含错误码与消息。
     * @return 响应体：code/message。
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<Map<String, Object>> handleBusiness(BusinessException ex) {
        return body(ex.getErrorCode(), ex.getMessage());
    }

    /**
     * 参数校验失败（@Valid）统一返回：HTTP 400。
     * 仅取首个字段错误的信息作为提示。
     *
     * @param ex Spring 的方法参数校验异常。
     * @return 响应体：code/message。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(FieldError::getDefaultMessage)
                .orElse(ErrorCode.BAD_REQUEST.getDefaultMessage());
        return body(ErrorCode.BAD_REQUEST, message);
    }

    /**
     * 约束校验失败（如 @Validated 参数）统一返回：HTTP 400。
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException ex) {
        return body(ErrorCode.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return body(ErrorCode.BAD_REQUEST, ErrorCode.BAD_REQUEST.getDefaultMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoResourceFoundException ex) {
        return body(ErrorCode.NOT_FOUND, ErrorCode.NOT_FOUND.getDefaultMessage());
    }

    /**
     * 会话/二次验证存储不可用：HTTP 503，不降级放行。
     */
    @ExceptionHandler(SecurityStoreException.class)
    public ResponseEntity<Map<String, Object>> handleStore(SecurityStoreException ex) {
        log.error("Security store unavailable", ex);
        return body(ErrorCode.SECURITY_STORE_UNAVAILABLE, ErrorCode.SECURITY_STORE_UNAVAILABLE.getDefaultMessage());
    }

    /**
     * 未处理异常统一返回：HTTP 500。
     * 记录错误日志并返回通用提示。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return body(ErrorCode.INTERNAL_ERROR, "服务异常，请稍后重试");
    }

    private static ResponseEntity<Map<String, Object>> body(ErrorCode errorCode, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("code", errorCode.getCode());
        body.put("message", message);
        return ResponseEntity.status(errorCode.getStatus()).body(body);
    }
}
