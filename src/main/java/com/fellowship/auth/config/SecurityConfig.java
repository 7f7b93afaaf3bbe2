package com.fellowship.auth.config;

import com.fellowship.auth.exception.ErrorCode;
import com.fellowship.auth.pipeline.JsonResponseWriter;
import com.fellowship.auth.pipeline.SecurityPipelineFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spring Security 安全配置。
 * <p>
 * - 关闭框架自带的 CSRF、安全头、表单登录与登出，这些由安全管线负责；
 * - 启用 CORS，当前允许所有来源（后续需替换白名单）；
 * - 无状态：身份来自服务端会话 Cookie，由 {@link SecurityPipelineFilter} 在授权前建立；
 * - 会话与二次验证管理接口需登录，其余接口放行（需二次验证的路由由管线拦截）。
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    /**
     * 配置 Spring Security 过滤链。
     *
     * @param http                   Spring 的 {@link HttpSecurity} 构建器。
     * @param securityPipelineFilter 安全管线过滤器。
     * @param jsonResponseWriter     未认证时的 JSON 写出。
     * @return 构建完成的 {@link SecurityFilterChain}。
     * @throws Exception 构建过滤链过程中可能抛出的异常。
     */
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   SecurityPipelineFilter securityPipelineFilter,
                                                   JsonResponseWriter jsonResponseWriter) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .headers(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .cors(Customizer.withDefaults())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .addFilterBefore(securityPipelineFilter, AuthorizationFilter.class)
                .exceptionHandling(handling -> handling.authenticationEntryPoint((request, response, ex) -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("code", ErrorCode.UNAUTHENTICATED.getCode());
                    body.put("message", ErrorCode.UNAUTHENTICATED.getDefaultMessage());
                    jsonResponseWriter.write(response, ErrorCode.UNAUTHENTICATED.getStatus().value(), body);
                }))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(
                                "/api/v1/auth/sessions",
                                "/api/v1/auth/sessions/**",
                                "/api/v1/auth/session/**",
                                "/api/v1/auth/2fa/**",
                                "/api/v1/auth/sign-out"
                        ).authenticated()
                        .anyRequest().permitAll()
                );
        return http.build();
    }

    /**
     * 定义并提供 CORS 配置源。
     *
     * <p>当前允许所有来源（后续建议替换为产品白名单），允许常见方法与请求头（含 CSRF 令牌头），且不携带凭证。</p>
     *
     * @return {@link CorsConfigurationSource}，用于为所有路径注册 CORS 规则。
     */
    @Bean
    public CorsConfigurationSource corsConfigurationSource(AuthProperties properties) {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOrigins(List.of("*")); // TODO replace with product whitelist
        configuration.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
        configuration.setAllowedHeaders(List.of("Content-Type", "X-Requested-With", properties.getCsrf().getHeaderName()));
        configuration.setAllowCredentials(false);
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }
}
