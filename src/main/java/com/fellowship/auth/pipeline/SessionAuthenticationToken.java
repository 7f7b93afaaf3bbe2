package com.fellowship.auth.pipeline;

import com.fellowship.auth.session.SessionRecord;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;

/**
 * 由服务端会话建立的认证信息。
 */
public class SessionAuthenticationToken extends AbstractAuthenticationToken {

    private final SessionPrincipal principal;

    public SessionAuthenticationToken(SessionRecord session) {
        super(AuthorityUtils.createAuthorityList("ROLE_USER"));
        this.principal = new SessionPrincipal(session.id(), session.userId(), session.twoFactorVerified());
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return "";
    }

    @Override
    public SessionPrincipal getPrincipal() {
        return principal;
    }
}
