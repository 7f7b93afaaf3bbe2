package com.fellowship.auth.pipeline;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 把安全管线接入 Spring Security 过滤链。
 * <p>
 * 管线结束后先写出安全响应头（管线异常时也写出）与 Cookie，再按结论返回 JSON 拒绝、重定向或继续；
 * 继续时若存在会话，则以 {@link SessionAuthenticationToken} 建立当前请求的认证信息。
 */
public class SecurityPipelineFilter extends OncePerRequestFilter {

    /** 模板中读取 CSP nonce 的请求属性名。 */
    public static final String CSP_NONCE_ATTRIBUTE = "cspNonce";

    private final SecurityPipeline pipeline;
    private final JsonResponseWriter responseWriter;

    public SecurityPipelineFilter(SecurityPipeline pipeline, JsonResponseWriter responseWriter) {
        this.pipeline = pipeline;
        this.responseWriter = responseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        RequestContext context = RequestContext.from(request);
        StageOutcome outcome;
        try {
            outcome = pipeline.evaluate(context);
        } finally {
            // 阶段抛出未预期异常时，500 响应同样带上安全响应头
            request.setAttribute(CSP_NONCE_ATTRIBUTE, context.getNonce());
            context.getResponseHeaders().forEach((name, values) -> values.forEach(value -> response.setHeader(name, value)));
        }
        for (ResponseCookie cookie : context.getResponseCookies()) {
            response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
        }

        switch (outcome.type()) {
            case REJECT -> responseWriter.write(response, outcome.status().value(), outcome.body());
            case REDIRECT -> {
                response.setStatus(outcome.status().value());
                response.setHeader(HttpHeaders.LOCATION, outcome.location());
            }
            default -> {
                context.currentSession().ifPresent(session -> {
                    SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
                    securityContext.setAuthentication(new SessionAuthenticationToken(session));
                    SecurityContextHolder.setContext(securityContext);
                });
                chain.doFilter(request, response);
            }
        }
    }
}
