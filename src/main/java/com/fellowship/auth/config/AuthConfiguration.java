package com.fellowship.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fellowship.auth.audit.LoggingSecurityEventSink;
import com.fellowship.auth.audit.SecurityEventSink;
import com.fellowship.auth.csrf.CsrfGuard;
import com.fellowship.auth.headers.NonceGenerator;
import com.fellowship.auth.headers.SecurityHeadersWriter;
import com.fellowship.auth.pipeline.CsrfStage;
import com.fellowship.auth.pipeline.JsonResponseWriter;
import com.fellowship.auth.pipeline.RouteClassificationStage;
import com.fellowship.auth.pipeline.SecurityPipeline;
import com.fellowship.auth.pipeline.SecurityPipelineFilter;
import com.fellowship.auth.pipeline.SessionRefreshStage;
import com.fellowship.auth.pipeline.TwoFactorStage;
import com.fellowship.auth.ratelimit.AllowAllRateLimitGate;
import com.fellowship.auth.ratelimit.RateLimitGate;
import com.fellowship.auth.route.RouteClassifier;
import com.fellowship.auth.session.SessionCleanupJob;
import com.fellowship.auth.session.SessionCookieFactory;
import com.fellowship.auth.session.SessionLifecycleService;
import com.fellowship.auth.session.SessionStore;
import com.fellowship.auth.token.HmacTokenCodec;
import com.fellowship.auth.token.TokenCodec;
import com.fellowship.auth.twofactor.TotpGenerator;
import com.fellowship.auth.twofactor.TwoFactorGate;
import com.fellowship.auth.twofactor.TwoFactorService;
import com.fellowship.auth.twofactor.TwoFactorStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.keygen.KeyGenerators;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;

/**
 * 安全管线相关 Bean 配置。
 * <p>
 * - {@link TokenCodec}：使用 {@code auth.csrf.secret} 作为签名密钥，未配置时启动期随机生成；
 * - 路由分类、CSRF、会话、二次验证各组件；
 * - 按 CSRF、会话刷新、路由分类、二次验证的顺序组装 {@link SecurityPipeline}；
 * - 过滤器只挂在 Spring Security 过滤链中，不单独注册到 Servlet 容器。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(AuthProperties.class)
@RequiredArgsConstructor
public class AuthConfiguration {

    private static final int GENERATED_KEY_BYTES = 32;

    private final AuthProperties properties;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenCodec tokenCodec(Clock clock) {
        String secret = properties.getCsrf().getSecret();
        byte[] key;
        if (secret == null || secret.isBlank()) {
            log.warn("auth.csrf.secret is not configured, using a random per-process key; tokens will not survive restarts");
            key = KeyGenerators.secureRandom(GENERATED_KEY_BYTES).generateKey();
        } else {
            key = secret.getBytes(StandardCharsets.UTF_8);
        }
        return new HmacTokenCodec(key, properties.getCsrf().getMaxAge(), clock);
    }

    @Bean
    public RouteClassifier routeClassifier() {
        return new RouteClassifier(properties.getRoutes());
    }

    @Bean
    @ConditionalOnMissingBean
    public SecurityEventSink securityEventSink() {
        return new LoggingSecurityEventSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimitGate rateLimitGate() {
        return new AllowAllRateLimitGate();
    }

    @Bean
    public CsrfGuard csrfGuard(TokenCodec tokenCodec, RouteClassifier routeClassifier) {
        return new CsrfGuard(tokenCodec, properties.getCsrf(), routeClassifier);
    }

    @Bean
    public SessionCookieFactory sessionCookieFactory() {
        return new SessionCookieFactory(properties.getSession(), properties.getTwoFactor());
    }

    @Bean
    public SessionLifecycleService sessionLifecycleService(SessionStore sessionStore, SecurityEventSink eventSink, Clock clock) {
        return new SessionLifecycleService(sessionStore, properties.getSession(), eventSink, clock);
    }

    @Bean
    public SessionCleanupJob sessionCleanupJob(SessionLifecycleService sessionLifecycleService) {
        return new SessionCleanupJob(sessionLifecycleService);
    }

    @Bean
    public TotpGenerator totpGenerator() {
        AuthProperties.TwoFactor twoFactor = properties.getTwoFactor();
        return new TotpGenerator(twoFactor.getPeriod(), twoFactor.getDigits());
    }

    @Bean
    public TwoFactorGate twoFactorGate(RouteClassifier routeClassifier, TwoFactorStore twoFactorStore) {
        return new TwoFactorGate(routeClassifier, twoFactorStore, properties.getTwoFactor());
    }

    @Bean
    public TwoFactorService twoFactorService(TwoFactorStore twoFactorStore, SessionStore sessionStore,
                                             TotpGenerator totpGenerator, SecurityEventSink eventSink, Clock clock) {
        return new TwoFactorService(twoFactorStore, sessionStore, totpGenerator, properties.getTwoFactor(), eventSink, clock);
    }

    @Bean
    public SecurityPipeline securityPipeline(CsrfGuard csrfGuard,
                                             SessionLifecycleService sessionLifecycleService,
                                             SessionCookieFactory sessionCookieFactory,
                                             RouteClassifier routeClassifier,
                                             TwoFactorGate twoFactorGate,
                                             SecurityEventSink eventSink) {
        SecurityPipeline pipeline = new SecurityPipeline(
                List.of(
                        new CsrfStage(csrfGuard, eventSink),
                        new SessionRefreshStage(sessionLifecycleService, sessionCookieFactory),
                        new RouteClassificationStage(routeClassifier),
                        new TwoFactorStage(twoFactorGate)
                ),
                new SecurityHeadersWriter(properties.getHeaders()),
                new NonceGenerator(),
                eventSink);
        log.info("Security pipeline assembled stages={}", pipeline.stageNames());
        return pipeline;
    }

    @Bean
    public JsonResponseWriter jsonResponseWriter(ObjectMapper objectMapper) {
        return new JsonResponseWriter(objectMapper);
    }

    @Bean
    public SecurityPipelineFilter securityPipelineFilter(SecurityPipeline securityPipeline, JsonResponseWriter jsonResponseWriter) {
        return new SecurityPipelineFilter(securityPipeline, jsonResponseWriter);
    }

    @Bean
    public FilterRegistrationBean<SecurityPipelineFilter> securityPipelineFilterRegistration(SecurityPipelineFilter filter) {
        FilterRegistrationBean<SecurityPipelineFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }
}
