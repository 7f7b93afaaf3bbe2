package com.fellowship.auth.pipeline;

import com.fellowship.auth.exception.SecurityStoreException;
import com.fellowship.auth.session.SessionCookieFactory;
import com.fellowship.auth.session.SessionLifecycleService;
import com.fellowship.auth.session.SessionRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 管线第二阶段：解析会话 Cookie、记录活跃并续发 Cookie。
 * <p>
 * 未知或已过期的会话 ID 会被清除，请求以匿名身份继续；存储不可用时同样匿名继续，
 * 需要会话的路由随后由二次验证阶段拒绝。
 */
@Slf4j
public class SessionRefreshStage implements PipelineStage {

    private final SessionLifecycleService sessions;
    private final SessionCookieFactory cookies;

    public SessionRefreshStage(SessionLifecycleService sessions, SessionCookieFactory cookies) {
        this.sessions = sessions;
        this.cookies = cookies;
    }

    @Override
    public String name() {
        return "session-refresh";
    }

    @Override
    public StageOutcome evaluate(RequestContext context) {
        Optional<String> sessionId = context.cookie(cookies.sessionCookieName()).filter(id -> !id.isBlank());
        if (sessionId.isEmpty()) {
            return StageOutcome.proceed();
        }
        Optional<SessionRecord> resolved = sessions.resolve(sessionId.get());
        if (resolved.isEmpty()) {
            log.debug("Unknown or expired session cookie cleared path={}", context.getPath());
            context.addResponseCookie(cookies.clearSessionCookie());
            return StageOutcome.proceed();
        }
        SessionRecord session = sessions.recordActivity(resolved.get());
        context.setSession(session);
        context.addResponseCookie(cookies.sessionCookie(session.id(), sessions.remainingLifetime(session)));
        return StageOutcome.proceed();
    }

    @Override
    public StageOutcome onStoreFailure(RequestContext context, SecurityStoreException error) {
        context.setSession(null);
        return StageOutcome.proceed();
    }
}
