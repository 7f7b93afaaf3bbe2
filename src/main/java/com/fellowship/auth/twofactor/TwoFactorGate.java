package com.fellowship.auth.twofactor;

import com.fellowship.auth.config.AuthProperties;
import com.fellowship.auth.route.RouteClassifier;
import com.fellowship.auth.session.SessionRecord;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * 二次验证闸门：判断路径是否需要加强验证，以及当前会话是否已满足要求。
 */
public class TwoFactorGate {

    private final RouteClassifier routeClassifier;
    private final TwoFactorStore store;
    private final AuthProperties.TwoFactor properties;

    public TwoFactorGate(RouteClassifier routeClassifier, TwoFactorStore store, AuthProperties.TwoFactor properties) {
        this.routeClassifier = routeClassifier;
        this.store = store;
        this.properties = properties;
    }

    public boolean requiresStepUp(String path) {
        return routeClassifier.requiresTwoFactor(path);
    }

    /**
     * 判断会话是否满足二次验证要求。
     * <p>
     * 用户开启了二次验证才有要求；会话上的已验证标记是唯一依据，客户端的标记 Cookie 不参与判断。
     *
     * @param session  当前会话。
     * @param returnTo 原始目标地址（路径 + 查询串）。
     * @return 判定结果。
     * @throws com.fellowship.auth.exception.SecurityStoreException 存储不可用时抛出。
     */
    public TwoFactorCheck checkRequirement(SessionRecord session, String returnTo) {
        boolean required = store.findEnrollment(session.userId()).isPresent();
        boolean verified = !required || session.twoFactorVerified();
        String redirectTarget = verified ? null : challengeLocation(returnTo);
        return new TwoFactorCheck(required, verified, redirectTarget);
    }

    /** 挑战页地址，如 {@code /auth/2fa-verify?redirect=%2Fsettings%3Ftab%3Dsecurity}。 */
    public String challengeLocation(String returnTo) {
        return UriComponentsBuilder.fromPath(properties.getChallengePath())
                .queryParam(properties.getReturnToParam(), "{returnTo}")
                .encode()
                .buildAndExpand(returnTo)
                .toUriString();
    }
}
