package com.fellowship.auth.pipeline;

import com.fellowship.auth.exception.ErrorCode;
import com.fellowship.auth.session.SessionRecord;
import com.fellowship.auth.twofactor.TwoFactorCheck;
import com.fellowship.auth.twofactor.TwoFactorGate;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 管线第四阶段：二次验证。
 * <p>
 * 无会话返回 401；开启了二次验证但本会话未验证时重定向到挑战页并带上原始地址。
 * 存储不可用时沿用默认处理（401），不放行。
 */
@Slf4j
public class TwoFactorStage implements PipelineStage {

    private final TwoFactorGate gate;

    public TwoFactorStage(TwoFactorGate gate) {
        this.gate = gate;
    }

    @Override
    public String name() {
        return "two-factor";
    }

    @Override
    public StageOutcome evaluate(RequestContext context) {
        Optional<SessionRecord> session = context.currentSession();
        if (session.isEmpty()) {
            return StageOutcome.reject(ErrorCode.UNAUTHENTICATED);
        }
        TwoFactorCheck check = gate.checkRequirement(session.get(), context.originalTarget());
        if (check.needsChallenge()) {
            log.debug("Two-factor challenge required userId={} path={}", session.get().userId(), context.getPath());
            return StageOutcome.redirect(check.redirectTarget());
        }
        return StageOutcome.proceed();
    }
}
