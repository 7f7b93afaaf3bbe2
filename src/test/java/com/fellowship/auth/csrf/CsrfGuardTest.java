package com.fellowship.auth.csrf;

import com.fellowship.auth.config.AuthProperties;
import com.fellowship.auth.pipeline.RequestContext;
import com.fellowship.auth.route.RouteClassifier;
import com.fellowship.auth.support.MutableClock;
import com.fellowship.auth.token.HmacTokenCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseCookie;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsrfGuardTest {

    private MutableClock clock;
    private HmacTokenCodec codec;
    private AuthProperties properties;
    private CsrfGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-02-01T12:00:00Z"));
        properties = new AuthProperties();
        codec = new HmacTokenCodec("csrf-guard-test-key-0123456789abcdef".getBytes(StandardCharsets.UTF_8),
                properties.getCsrf().getMaxAge(), clock);
        guard = new CsrfGuard(codec, properties.getCsrf(), new RouteClassifier(properties.getRoutes()));
    }

    @Test
    void safeMethods_areNeverRejected_andReceiveFreshCookie() {
        for (String method : List.of("GET", "HEAD", "OPTIONS", "TRACE")) {
            CsrfDecision withoutCookie = guard.protect(RequestContext.builder(method, "/community").build());
            CsrfDecision withGarbage = guard.protect(RequestContext.builder(method, "/community")
                    .cookie("csrf-token", "garbage").build());

            assertThat(withoutCookie.verdict()).isEqualTo(CsrfDecision.Verdict.ALLOW_WITH_FRESH_COOKIE);
            assertThat(withGarbage.verdict()).isEqualTo(CsrfDecision.Verdict.ALLOW_WITH_FRESH_COOKIE);
            assertThat(codec.isValid(withoutCookie.freshCookie().getValue())).isTrue();
        }
    }

    @Test
    void freshCookie_isReadableByScriptsAndScopedToSite() {
        ResponseCookie cookie = guard.protect(RequestContext.builder("GET", "/community").build()).freshCookie();

        assertThat(cookie.getName()).isEqualTo("csrf-token");
        assertThat(cookie.isHttpOnly()).isFalse();
        assertThat(cookie.getSameSite()).isEqualTo("Lax");
        assertThat(cookie.getPath()).isEqualTo("/");
        assertThat(cookie.getMaxAge()).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void safeMethod_withValidCookie_isAllowedWithoutReissue() {
        CsrfDecision decision = guard.protect(RequestContext.builder("GET", "/community")
                .cookie("csrf-token", codec.issue()).build());

        assertThat(decision.verdict()).isEqualTo(CsrfDecision.Verdict.ALLOW);
        assertThat(decision.freshCookie()).isNull();
    }

    @Test
    void unsafeMethod_withoutSubmittedToken_isMissing() {
        CsrfDecision decision = guard.protect(RequestContext.builder("POST", "/api/posts")
                .cookie("csrf-token", codec.issue()).build());

        assertThat(decision.isRejected()).isTrue();
        assertThat(decision.failure()).isEqualTo(CsrfFailure.MISSING);
    }

    @Test
    void unsafeMethod_withBlankHeader_isMissing() {
        CsrfDecision decision = guard.protect(RequestContext.builder("DELETE", "/api/posts/1")
                .header("X-CSRF-Token", "  ")
                .cookie("csrf-token", codec.issue()).build());

        assertThat(decision.failure()).isEqualTo(CsrfFailure.MISSING);
    }

    @Test
    void unsafeMethod_withInvalidHeaderToken_isInvalid() {
        String unsigned = "a".repeat(64) + ".18c0a1b2c3d" + "." + "b".repeat(32);

        CsrfDecision decision = guard.protect(RequestContext.builder("PUT", "/api/posts/1")
                .header("X-CSRF-Token", unsigned)
                .cookie("csrf-token", codec.issue()).build());

        assertThat(decision.failure()).isEqualTo(CsrfFailure.INVALID);
    }

    @Test
    void unsafeMethod_withValidHeaderButNoCookie_isMissing() {
        CsrfDecision decision = guard.protect(RequestContext.builder("POST", "/api/posts")
                .header("X-CSRF-Token", codec.issue()).build());

        assertThat(decision.failure()).isEqualTo(CsrfFailure.MISSING);
    }

    @Test
    void unsafeMethod_withInvalidCookie_isInvalid() {
        CsrfDecision decision = guard.protect(RequestContext.builder("PATCH", "/api/posts/1")
                .header("X-CSRF-Token", codec.issue())
                .cookie("csrf-token", "tampered").build());

        assertThat(decision.failure()).isEqualTo(CsrfFailure.INVALID);
    }

    @Test
    void unsafeMethod_withTwoIndependentlyValidTokens_isAllowed() {
        CsrfDecision decision = guard.protect(RequestContext.builder("POST", "/api/posts")
                .header("X-CSRF-Token", codec.issue())
                .cookie("csrf-token", codec.issue()).build());

        assertThat(decision.verdict()).isEqualTo(CsrfDecision.Verdict.ALLOW);
    }

    @Test
    void matchingCookieRequired_rejectsDifferentTokens() {
        properties.getCsrf().setRequireMatchingCookie(true);
        String token = codec.issue();

        CsrfDecision mismatched = guard.protect(RequestContext.builder("POST", "/api/posts")
                .header("X-CSRF-Token", codec.issue())
                .cookie("csrf-token", token).build());
        CsrfDecision matched = guard.protect(RequestContext.builder("POST", "/api/posts")
                .header("X-CSRF-Token", token)
                .cookie("csrf-token", token).build());

        assertThat(mismatched.failure()).isEqualTo(CsrfFailure.INVALID);
        assertThat(matched.verdict()).isEqualTo(CsrfDecision.Verdict.ALLOW);
    }

    @Test
    void expiredSubmittedToken_isInvalid() {
        String token = codec.issue();
        clock.advance(Duration.ofMinutes(31));

        CsrfDecision decision = guard.protect(RequestContext.builder("POST", "/api/posts")
                .header("X-CSRF-Token", token)
                .cookie("csrf-token", codec.issue()).build());

        assertThat(decision.failure()).isEqualTo(CsrfFailure.INVALID);
    }

    @Test
    void formField_isAcceptedWhenHeaderAbsent() {
        CsrfDecision decision = guard.protect(RequestContext.builder("POST", "/community/join")
                .formParameter("csrf_token", codec.issue())
                .cookie("csrf-token", codec.issue()).build());

        assertThat(decision.verdict()).isEqualTo(CsrfDecision.Verdict.ALLOW);
    }

    @Test
    void exemptRoute_isAllowedWithoutTokens() {
        CsrfDecision decision = guard.protect(RequestContext.builder("POST", "/api/webhooks/stripe").build());

        assertThat(decision.verdict()).isEqualTo(CsrfDecision.Verdict.ALLOW);
    }

    @Test
    void unsafeMethod_onPathWithAssetExtension_stillNeedsTokens() {
        for (String path : List.of("/api/admin/users/42.png", "/settings/export.js", "/community/posts/7.css")) {
            CsrfDecision decision = guard.protect(RequestContext.builder("POST", path).build());

            assertThat(decision.isRejected()).as(path).isTrue();
            assertThat(decision.failure()).as(path).isEqualTo(CsrfFailure.MISSING);
        }
    }

    @Test
    void unsafeMethod_onLookalikeOfExemptPrefix_stillNeedsTokens() {
        CsrfDecision decision = guard.protect(RequestContext.builder("POST", "/api/csrf-tokens/rotate").build());

        assertThat(decision.failure()).isEqualTo(CsrfFailure.MISSING);
    }

    @Test
    void tokenForClient_reusesValidCookieToken_andReplacesInvalidOne() {
        String existing = codec.issue();

        assertThat(guard.tokenForClient(existing)).isEqualTo(existing);
        assertThat(guard.tokenForClient("stale")).isNotEqualTo("stale").satisfies(t -> assertThat(codec.isValid(t)).isTrue());
        assertThat(codec.isValid(guard.tokenForClient(null))).isTrue();
    }
}
