package com.fellowship.auth;

import com.fellowship.auth.model.ClientInfo;
import com.fellowship.auth.session.SessionLifecycleService;
import com.fellowship.auth.session.SessionRecord;
import com.fellowship.auth.token.TokenCodec;
import com.fellowship.auth.twofactor.TwoFactorEnrollment;
import com.fellowship.auth.twofactor.TwoFactorStore;
import jakarta.servlet.http.Cookie;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 端到端验证安全管线与会话、二次验证接口（内存存储）。
 */
@SpringBootTest(properties = {
        "auth.store.type=memory",
        "auth.csrf.secret=integration-test-signing-key-0123456789",
        "auth.session.cron-secret=cron-test-secret"
})
@AutoConfigureMockMvc
class SecurityPipelineIntegrationTest {

    private static final AtomicLong USER_IDS = new AtomicLong(1000);
    private static final ClientInfo CLIENT = new ClientInfo("127.0.0.1",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_0) AppleWebKit/605.1.15");
    private static final String BACKUP_CODE = "ABCD1234";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SessionLifecycleService sessionLifecycleService;

    @Autowired
    private TwoFactorStore twoFactorStore;

    @Autowired
    private TokenCodec tokenCodec;

    @Test
    void anonymousRequestToSessionList_isUnauthorized_withSecurityHeaders() throws Exception {
        mockMvc.perform(get("/api/v1/auth/sessions"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"))
                .andExpect(header().string("X-Frame-Options", "DENY"))
                .andExpect(header().exists("Content-Security-Policy"));
    }

    @Test
    void unverifiedSessionOfEnrolledUser_isRedirected_thenAllowedAfterBackupCode() throws Exception {
        long userId = USER_IDS.incrementAndGet();
        SessionRecord session = sessionLifecycleService.createSession(userId, CLIENT);
        enrollTwoFactor(userId);

        mockMvc.perform(get("/api/v1/auth/sessions").cookie(sessionCookie(session)))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION, "/auth/2fa-verify?redirect=%2Fapi%2Fv1%2Fauth%2Fsessions"))
                .andExpect(header().exists("Content-Security-Policy"))
                .andExpect(header().string("X-Content-Type-Options", "nosniff"));

        MvcResult verified = mockMvc.perform(withCsrf(post("/api/v1/auth/2fa/verify"))
                        .cookie(sessionCookie(session))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"abcd-1234\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.method").value("BACKUP_CODE"))
                .andExpect(jsonPath("$.backupCodesRemaining").value(0))
                .andReturn();
        assertThat(verified.getResponse().getHeaders(HttpHeaders.SET_COOKIE))
                .anySatisfy(cookie -> assertThat(cookie).startsWith("2fa_verified=true").contains("HttpOnly"));

        mockMvc.perform(get("/api/v1/auth/sessions").cookie(sessionCookie(session)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessions[0].id").value(session.id()))
                .andExpect(jsonPath("$.sessions[0].current").value(true))
                .andExpect(jsonPath("$.sessions[0].deviceInfo").value("Mac Computer"));
    }

    @Test
    void usedBackupCode_isRejectedOnSecondSession() throws Exception {
        long userId = USER_IDS.incrementAndGet();
        SessionRecord first = sessionLifecycleService.createSession(userId, CLIENT);
        SessionRecord second = sessionLifecycleService.createSession(userId, CLIENT);
        enrollTwoFactor(userId);

        mockMvc.perform(withCsrf(post("/api/v1/auth/2fa/verify"))
                        .cookie(sessionCookie(first))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"" + BACKUP_CODE + "\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(withCsrf(post("/api/v1/auth/2fa/verify"))
                        .cookie(sessionCookie(second))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"" + BACKUP_CODE + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TWO_FACTOR_CODE_INVALID"));
    }

    @Test
    void safeRequest_issuesCsrfCookieAndReissuesSessionCookie() throws Exception {
        SessionRecord session = sessionLifecycleService.createSession(USER_IDS.incrementAndGet(), CLIENT);

        MvcResult result = mockMvc.perform(get("/api/v1/auth/2fa/status").cookie(sessionCookie(session)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false))
                .andReturn();

        assertThat(result.getResponse().getHeaders(HttpHeaders.SET_COOKIE))
                .anySatisfy(cookie -> assertThat(cookie).startsWith("csrf-token=").doesNotContain("HttpOnly"))
                .anySatisfy(cookie -> assertThat(cookie).startsWith("session_id=" + session.id()).contains("HttpOnly"));
    }

    @Test
    void cookieIssuedOnSafeRequest_authorizesFollowingPost() throws Exception {
        SessionRecord session = sessionLifecycleService.createSession(USER_IDS.incrementAndGet(), CLIENT);

        MvcResult first = mockMvc.perform(get("/api/v1/auth/2fa/status").cookie(sessionCookie(session)))
                .andExpect(status().isOk())
                .andReturn();
        Cookie csrfCookie = first.getResponse().getCookie("csrf-token");
        assertThat(csrfCookie).isNotNull();

        mockMvc.perform(post("/api/v1/auth/session/refresh")
                        .cookie(sessionCookie(session), new Cookie("csrf-token", csrfCookie.getValue()))
                        .header("X-CSRF-Token", csrfCookie.getValue()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value(session.id()));
    }

    @Test
    void csrfTokenEndpoint_returnsUsableToken() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/csrf-token"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CACHE_CONTROL, "no-store"))
                .andReturn();
        String token = result.getResponse().getCookie("csrf-token").getValue();

        assertThat(tokenCodec.isValid(token)).isTrue();
        assertThat(result.getResponse().getContentAsString()).contains(token);
    }

    @Test
    void refresh_withValidCsrfTokens_extendsSession() throws Exception {
        SessionRecord session = sessionLifecycleService.createSession(USER_IDS.incrementAndGet(), CLIENT);

        mockMvc.perform(withCsrf(post("/api/v1/auth/session/refresh")).cookie(sessionCookie(session)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value(session.id()));
    }

    @Test
    void unsafeRequest_withoutCsrfToken_isForbidden() throws Exception {
        SessionRecord session = sessionLifecycleService.createSession(USER_IDS.incrementAndGet(), CLIENT);

        mockMvc.perform(post("/api/v1/auth/session/refresh").cookie(sessionCookie(session)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("CSRF_MISSING"))
                .andExpect(jsonPath("$.reason").value("missing"))
                .andExpect(header().exists("Content-Security-Policy"));
    }

    @Test
    void unsafeRequest_withUnsignedToken_isForbiddenAsInvalid() throws Exception {
        String unsigned = "a".repeat(64) + "." + Long.toHexString(System.currentTimeMillis()) + "." + "b".repeat(32);

        mockMvc.perform(post("/api/v1/auth/sign-out")
                        .header("X-CSRF-Token", unsigned)
                        .cookie(new Cookie("csrf-token", unsigned)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("invalid"))
                .andExpect(header().string("X-Frame-Options", "DENY"));
    }

    @Test
    void revokeOthers_keepsCurrentSession_andSecondCallRevokesNothing() throws Exception {
        long userId = USER_IDS.incrementAndGet();
        SessionRecord current = sessionLifecycleService.createSession(userId, CLIENT);
        sessionLifecycleService.createSession(userId, CLIENT);
        sessionLifecycleService.createSession(userId, CLIENT);

        mockMvc.perform(withCsrf(post("/api/v1/auth/sessions/revoke-others")).cookie(sessionCookie(current)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revoked").value(2));
        mockMvc.perform(withCsrf(post("/api/v1/auth/sessions/revoke-others")).cookie(sessionCookie(current)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revoked").value(0));

        assertThat(sessionLifecycleService.listSessions(userId)).extracting(SessionRecord::id).containsExactly(current.id());
    }

    @Test
    void revokingAnotherUsersSession_isNotFound() throws Exception {
        SessionRecord mine = sessionLifecycleService.createSession(USER_IDS.incrementAndGet(), CLIENT);
        SessionRecord theirs = sessionLifecycleService.createSession(USER_IDS.incrementAndGet(), CLIENT);

        mockMvc.perform(withCsrf(post("/api/v1/auth/sessions/revoke"))
                        .cookie(sessionCookie(mine))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"" + theirs.id() + "\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));

        assertThat(sessionLifecycleService.resolve(theirs.id())).isPresent();
    }

    @Test
    void signOut_revokesSessionAndClearsCookies() throws Exception {
        SessionRecord session = sessionLifecycleService.createSession(USER_IDS.incrementAndGet(), CLIENT);

        MvcResult result = mockMvc.perform(withCsrf(post("/api/v1/auth/sign-out")).cookie(sessionCookie(session)))
                .andExpect(status().isNoContent())
                .andReturn();

        assertThat(result.getResponse().getHeaders(HttpHeaders.SET_COOKIE))
                .anySatisfy(cookie -> assertThat(cookie).startsWith("session_id=;").contains("Max-Age=0"))
                .anySatisfy(cookie -> assertThat(cookie).startsWith("2fa_verified=;").contains("Max-Age=0"));
        mockMvc.perform(get("/api/v1/auth/2fa/status").cookie(sessionCookie(session)))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void verify_withBlankCode_isBadRequest() throws Exception {
        SessionRecord session = sessionLifecycleService.createSession(USER_IDS.incrementAndGet(), CLIENT);

        mockMvc.perform(withCsrf(post("/api/v1/auth/2fa/verify"))
                        .cookie(sessionCookie(session))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void cronCleanup_requiresBearerSecret() throws Exception {
        mockMvc.perform(get("/api/cron/cleanup-sessions"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("CRON_UNAUTHORIZED"));
        mockMvc.perform(get("/api/cron/cleanup-sessions").header(HttpHeaders.AUTHORIZATION, "Bearer wrong"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/cron/cleanup-sessions").header(HttpHeaders.AUTHORIZATION, "Bearer cron-test-secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.removed").isNumber());
    }

    private void enrollTwoFactor(long userId) {
        twoFactorStore.saveEnrollment(
                new TwoFactorEnrollment(userId, "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ", Instant.now(), -1),
                Set.of(DigestUtils.sha256Hex(BACKUP_CODE)));
    }

    private MockHttpServletRequestBuilder withCsrf(MockHttpServletRequestBuilder builder) {
        String token = tokenCodec.issue();
        return builder.header("X-CSRF-Token", token).cookie(new Cookie("csrf-token", token));
    }

    private static Cookie sessionCookie(SessionRecord session) {
        return new Cookie("session_id", session.id());
    }
}
