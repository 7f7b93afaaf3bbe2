package com.fellowship.auth.pipeline;

import com.fellowship.auth.audit.SecurityEventSink;
import com.fellowship.auth.audit.SecurityEvents;
import com.fellowship.auth.csrf.CsrfDecision;
import com.fellowship.auth.csrf.CsrfFailure;
import com.fellowship.auth.csrf.CsrfGuard;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 管线第一阶段：CSRF 校验。
 */
public class CsrfStage implements PipelineStage {

    private final CsrfGuard guard;
    private final SecurityEventSink eventSink;

    public CsrfStage(CsrfGuard guard, SecurityEventSink eventSink) {
        this.guard = guard;
        this.eventSink = eventSink;
    }

    @Override
    public String name() {
        return "csrf";
    }

    @Override
    public StageOutcome evaluate(RequestContext context) {
        CsrfDecision decision = guard.protect(context);
        switch (decision.verdict()) {
            case ALLOW_WITH_FRESH_COOKIE -> context.addResponseCookie(decision.freshCookie());
            case REJECT -> {
                return reject(context, decision.failure());
            }
            default -> {
            }
        }
        return StageOutcome.proceed();
    }

    private StageOutcome reject(RequestContext context, CsrfFailure failure) {
        eventSink.info(SecurityEvents.CSRF_REJECTED, Map.of(
                "method", context.getMethod(),
                "path", context.getPath(),
                "reason", failure.getReason()));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", failure.getErrorCode().getCode());
        body.put("reason", failure.getReason());
        body.put("message", failure.getErrorCode().getDefaultMessage());
        return StageOutcome.reject(failure.getErrorCode().getStatus(), body);
    }
}
