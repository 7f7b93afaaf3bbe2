package com.fellowship.auth.pipeline;

import com.fellowship.auth.model.ClientInfo;
import com.fellowship.auth.route.RouteClass;
import com.fellowship.auth.session.SessionRecord;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.Getter;
import lombok.Setter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseCookie;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 单次请求在安全管线中流转的上下文。
 * <p>
 * 入站部分（方法、路径、请求头、Cookie、表单字段、客户端信息）只读；
 * 各阶段的结论（路由分类、当前会话、CSP nonce）与待写出的 Cookie、响应头记录在此，
 * 由过滤器在管线结束后统一写到 HTTP 响应上。
 */
@Getter
public class RequestContext {

    private final String method;
    private final String path;
    private final String query;
    private final HttpHeaders headers;
    private final Map<String, String> cookies;
    private final Map<String, String> formParameters;
    private final ClientInfo client;

    @Setter
    private String nonce;
    @Setter
    private RouteClass routeClass;
    @Setter
    private SessionRecord session;

    private final List<ResponseCookie> responseCookies = new ArrayList<>();
    private final HttpHeaders responseHeaders = new HttpHeaders();

    private RequestContext(Builder builder) {
        this.method = builder.method;
        this.path = builder.path;
        this.query = builder.query;
        this.headers = HttpHeaders.readOnlyHttpHeaders(builder.headers);
        this.cookies = Collections.unmodifiableMap(builder.cookies);
        this.formParameters = Collections.unmodifiableMap(builder.formParameters);
        this.client = builder.client;
    }

    /**
     * 从 Servlet 请求构造上下文。表单字段只在 {@code application/x-www-form-urlencoded} 请求上读取。
     *
     * @param request HTTP 请求。
     * @return 请求上下文。
     */
    public static RequestContext from(HttpServletRequest request) {
        Builder builder = builder(request.getMethod(), pathOf(request))
                .query(request.getQueryString())
                .client(ClientInfo.from(request));
        Collections.list(request.getHeaderNames())
                .forEach(name -> Collections.list(request.getHeaders(name)).forEach(value -> builder.header(name, value)));
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                builder.cookie(cookie.getName(), cookie.getValue());
            }
        }
        String contentType = request.getContentType();
        if (contentType != null && contentType.startsWith(MediaType.APPLICATION_FORM_URLENCODED_VALUE)) {
            request.getParameterMap().forEach((name, values) -> {
                if (values.length > 0) {
                    builder.formParameter(name, values[0]);
                }
            });
        }
        return builder.build();
    }

    public static Builder builder(String method, String path) {
        return new Builder(method, path);
    }

    public Optional<String> cookie(String name) {
        return Optional.ofNullable(cookies.get(name));
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.getFirst(name));
    }

    public Optional<String> formParameter(String name) {
        return Optional.ofNullable(formParameters.get(name));
    }

    public Optional<SessionRecord> currentSession() {
        return Optional.ofNullable(session);
    }

    /** 原始目标地址（路径 + 查询串），用于二次验证后的回跳。 */
    public String originalTarget() {
        return query == null || query.isEmpty() ? path : path + "?" + query;
    }

    public void addResponseCookie(ResponseCookie cookie) {
        responseCookies.add(cookie);
    }

    public void setResponseHeader(String name, String value) {
        responseHeaders.set(name, value);
    }

    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }

    public static final class Builder {
        private final String method;
        private final String path;
        private String query;
        private final HttpHeaders headers = new HttpHeaders();
        private final Map<String, String> cookies = new LinkedHashMap<>();
        private final Map<String, String> formParameters = new LinkedHashMap<>();
        private ClientInfo client = new ClientInfo(null, null);

        private Builder(String method, String path) {
            this.method = method;
            this.path = path;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder header(String name, String value) {
            headers.add(name, value);
            return this;
        }

        public Builder cookie(String name, String value) {
            cookies.put(name, value);
            return this;
        }

        public Builder formParameter(String name, String value) {
            formParameters.put(name, value);
            return this;
        }

        public Builder client(ClientInfo client) {
            this.client = client;
            return this;
        }

        public RequestContext build() {
            return new RequestContext(this);
        }
    }
}
