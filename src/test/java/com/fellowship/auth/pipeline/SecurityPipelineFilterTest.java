package com.fellowship.auth.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fellowship.auth.audit.SecurityEventSink;
import com.fellowship.auth.config.AuthProperties;
import com.fellowship.auth.csrf.CsrfGuard;
import com.fellowship.auth.headers.NonceGenerator;
import com.fellowship.auth.headers.SecurityHeadersWriter;
import com.fellowship.auth.route.RouteClassifier;
import com.fellowship.auth.support.MutableClock;
import com.fellowship.auth.token.HmacTokenCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class SecurityPipelineFilterTest {

    private AuthProperties properties;
    private HmacTokenCodec codec;
    private SecurityEventSink eventSink;

    @BeforeEach
    void setUp() {
        properties = new AuthProperties();
        codec = new HmacTokenCodec("filter-test-key-0123456789abcdef".getBytes(StandardCharsets.UTF_8),
                properties.getCsrf().getMaxAge(), new MutableClock(Instant.parse("2026-05-04T09:00:00Z")));
        eventSink = mock(SecurityEventSink.class);
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void unexpectedStageError_stillWritesSecurityHeadersToResponse() {
        PipelineStage broken = new PipelineStage() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public StageOutcome evaluate(RequestContext context) {
                throw new NumberFormatException("For input string: \"corrupt\"");
            }
        };
        SecurityPipelineFilter filter = filter(List.of(broken));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/community");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(NumberFormatException.class);

        String nonce = (String) request.getAttribute(SecurityPipelineFilter.CSP_NONCE_ATTRIBUTE);
        assertThat(nonce).isNotBlank();
        assertThat(response.getHeader(SecurityHeadersWriter.CONTENT_SECURITY_POLICY)).contains("'nonce-" + nonce + "'");
        assertThat(response.getHeader("X-Frame-Options")).isEqualTo("DENY");
        assertThat(response.getHeader("X-Content-Type-Options")).isEqualTo("nosniff");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void csrfRejection_writesOrderedJsonBodyWithHeaders() throws Exception {
        SecurityPipelineFilter filter = filter(List.of(csrfStage()));
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/posts");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentAsString())
                .startsWith("{\"code\":\"CSRF_MISSING\",\"reason\":\"missing\",\"message\":");
        assertThat(response.getHeader("X-Frame-Options")).isEqualTo("DENY");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void allowedRequest_reachesChainWithCookieAndHeaders() throws Exception {
        SecurityPipelineFilter filter = filter(List.of(csrfStage()));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/community");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(response.getHeaders("Set-Cookie")).anySatisfy(cookie -> assertThat(cookie).startsWith("csrf-token="));
        assertThat(response.getHeader(SecurityHeadersWriter.CONTENT_SECURITY_POLICY)).contains("'nonce-");
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    private CsrfStage csrfStage() {
        return new CsrfStage(new CsrfGuard(codec, properties.getCsrf(), new RouteClassifier(properties.getRoutes())), eventSink);
    }

    private SecurityPipelineFilter filter(List<PipelineStage> stages) {
        SecurityPipeline pipeline = new SecurityPipeline(stages,
                new SecurityHeadersWriter(properties.getHeaders()), new NonceGenerator(), eventSink);
        return new SecurityPipelineFilter(pipeline, new JsonResponseWriter(new ObjectMapper()));
    }
}
