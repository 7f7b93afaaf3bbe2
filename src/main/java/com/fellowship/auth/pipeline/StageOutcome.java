package com.fellowship.auth.pipeline;

import com.fellowship.auth.exception.ErrorCode;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 管线阶段的结论。
 *
 * @param type     结论类型。
 * @param status   拒绝时的 HTTP 状态。
 * @param body     拒绝时的 JSON 响应体。
 * @param location 重定向地址。
 */
public record StageOutcome(Type type, HttpStatus status, Map<String, Object> body, String location) {

    public enum Type {
        /** 交给下一阶段。 */
        CONTINUE,
        /** 放行请求，跳过剩余阶段。 */
        SKIP_REMAINING,
        /** 拒绝并返回 JSON。 */
        REJECT,
        /** 重定向。 */
        REDIRECT
    }

    private static final StageOutcome PROCEED = new StageOutcome(Type.CONTINUE, null, null, null);
    private static final StageOutcome SKIP = new StageOutcome(Type.SKIP_REMAINING, null, null, null);

    public static StageOutcome proceed() {
        return PROCEED;
    }

    public static StageOutcome skipRemaining() {
        return SKIP;
    }

    public static StageOutcome reject(HttpStatus status, Map<String, Object> body) {
        return new StageOutcome(Type.REJECT, status, Collections.unmodifiableMap(new LinkedHashMap<>(body)), null);
    }

    /** 以错误码的状态与 {@code code/message} 响应体拒绝。 */
    public static StageOutcome reject(ErrorCode errorCode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", errorCode.getCode());
        body.put("message", errorCode.getDefaultMessage());
        return reject(errorCode.getStatus(), body);
    }

    public static StageOutcome redirect(String location) {
        return new StageOutcome(Type.REDIRECT, HttpStatus.FOUND, null, location);
    }

    /** 请求是否继续进入应用逻辑。 */
    public boolean forwards() {
        return type == Type.CONTINUE || type == Type.SKIP_REMAINING;
    }
}
