package com.fellowship.auth.session;

import com.fellowship.auth.audit.SecurityEventSink;
import com.fellowship.auth.audit.SecurityEvents;
import com.fellowship.auth.config.AuthProperties;
import com.fellowship.auth.exception.BusinessException;
import com.fellowship.auth.exception.ErrorCode;
import com.fellowship.auth.model.ClientInfo;
import com.fellowship.auth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SessionLifecycleServiceTest {

    private static final ClientInfo IPHONE = new ClientInfo("198.51.100.4",
            "Mozilla/5.0 (iPhone; CPU iPhone OS 17_0 like Mac OS X) Mobile/15E148");
    private static final ClientInfo DESKTOP = new ClientInfo("198.51.100.5",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64)");

    private MutableClock clock;
    private InMemorySessionStore store;
    private AuthProperties.Session properties;
    private SecurityEventSink eventSink;
    private SessionLifecycleService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-05-10T07:30:00Z"));
        store = new InMemorySessionStore();
        properties = new AuthProperties().getSession();
        eventSink = mock(SecurityEventSink.class);
        service = new SessionLifecycleService(store, properties, eventSink, clock);
    }

    @Test
    void createSession_setsLifetimeDeviceAndUnverifiedFlag() {
        SessionRecord session = service.createSession(42L, IPHONE);

        assertThat(session.id()).matches("[0-9a-f]{64}");
        assertThat(session.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofDays(30)));
        assertThat(session.deviceInfo()).isEqualTo("iPhone");
        assertThat(session.ipAddress()).isEqualTo("198.51.100.4");
        assertThat(session.twoFactorVerified()).isFalse();
        assertThat(store.getSession(session.id())).contains(session);
        verify(eventSink).info(eq(SecurityEvents.SESSION_CREATED), anyMap());
    }

    @Test
    void revokeAllOthers_keepsCurrentSession_andIsIdempotent() {
        SessionRecord current = service.createSession(42L, DESKTOP);
        service.createSession(42L, IPHONE);
        service.createSession(42L, IPHONE);
        SessionRecord foreign = service.createSession(7L, DESKTOP);

        assertThat(service.revokeAllOtherSessions(current.id(), 42L)).isEqualTo(2);
        assertThat(service.revokeAllOtherSessions(current.id(), 42L)).isZero();
        assertThat(service.listSessions(42L)).extracting(SessionRecord::id).containsExactly(current.id());
        assertThat(service.resolve(foreign.id())).isPresent();
    }

    @Test
    void listSessions_ordersByMostRecentActivity() {
        SessionRecord first = service.createSession(42L, DESKTOP);
        clock.advance(Duration.ofMinutes(1));
        SessionRecord second = service.createSession(42L, IPHONE);
        clock.advance(Duration.ofMinutes(2));

        service.recordActivity(first);

        assertThat(service.listSessions(42L)).extracting(SessionRecord::id)
                .containsExactly(first.id(), second.id());
    }

    @Test
    void recordActivity_withinInterval_doesNotWrite() {
        SessionRecord session = service.createSession(42L, DESKTOP);
        clock.advance(Duration.ofSeconds(30));

        SessionRecord result = service.recordActivity(session);

        assertThat(result.lastActivity()).isEqualTo(session.lastActivity());
        assertThat(store.getSession(session.id()).orElseThrow().lastActivity()).isEqualTo(session.lastActivity());
    }

    @Test
    void recordActivity_doesNotExtendExpiry() {
        SessionRecord session = service.createSession(42L, DESKTOP);
        clock.advance(Duration.ofHours(2));

        SessionRecord result = service.recordActivity(session);

        assertThat(result.lastActivity()).isEqualTo(clock.instant());
        assertThat(store.getSession(session.id()).orElseThrow().expiresAt()).isEqualTo(session.expiresAt());
    }

    @Test
    void resolve_expiredSession_isEmptyAndRevoked() {
        SessionRecord session = service.createSession(42L, DESKTOP);
        clock.advance(Duration.ofDays(30));

        assertThat(service.resolve(session.id())).isEmpty();
        assertThat(store.getSession(session.id())).isEmpty();
    }

    @Test
    void resolve_unknownOrBlankId_isEmpty() {
        assertThat(service.resolve(null)).isEmpty();
        assertThat(service.resolve(" ")).isEmpty();
        assertThat(service.resolve("does-not-exist")).isEmpty();
    }

    @Test
    void extend_resetsExpiryFromNow() {
        SessionRecord session = service.createSession(42L, DESKTOP);
        clock.advance(Duration.ofDays(10));

        SessionRecord extended = service.extend(session.id());

        assertThat(extended.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofDays(30)));
        assertThat(store.getSession(session.id()).orElseThrow().expiresAt()).isEqualTo(extended.expiresAt());
        assertThat(service.remainingLifetime(extended)).isEqualTo(Duration.ofDays(30));
    }

    @Test
    void extend_unknownSession_fails() {
        assertThatThrownBy(() -> service.extend("missing"))
                .isInstanceOf(BusinessException.class)
                .extracting(ex -> ((BusinessException) ex).getErrorCode())
                .isEqualTo(ErrorCode.SESSION_REFRESH_FAILED);
    }

    @Test
    void cleanupExpired_removesOnlyExpiredSessions() {
        SessionRecord old = service.createSession(42L, DESKTOP);
        clock.advance(Duration.ofDays(20));
        SessionRecord recent = service.createSession(42L, IPHONE);
        clock.advance(Duration.ofDays(11));

        assertThat(service.cleanupExpired()).isEqualTo(1);
        assertThat(store.getSession(old.id())).isEmpty();
        assertThat(store.getSession(recent.id())).isPresent();
        verify(eventSink).info(eq(SecurityEvents.SESSION_CLEANUP_COMPLETED), anyMap());
    }

    @Test
    void createSession_evictsLeastRecentlyActiveBeyondCap() {
        properties.setMaxSessionsPerUser(3);
        SessionRecord oldest = service.createSession(42L, DESKTOP);
        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofSeconds(1));
            service.createSession(42L, IPHONE);
        }

        List<SessionRecord> sessions = service.listSessions(42L);
        assertThat(sessions).hasSize(3);
        assertThat(sessions).extracting(SessionRecord::id).doesNotContain(oldest.id());
    }

    @Test
    void revokeSession_ofAnotherUser_isNotFound() {
        SessionRecord foreign = service.createSession(7L, DESKTOP);

        assertThatThrownBy(() -> service.revokeSession(42L, foreign.id()))
                .isInstanceOf(BusinessException.class)
                .extracting(ex -> ((BusinessException) ex).getErrorCode())
                .isEqualTo(ErrorCode.SESSION_NOT_FOUND);
        assertThat(store.getSession(foreign.id())).isPresent();
    }

    @Test
    void signOut_revokesCurrentSession() {
        SessionRecord session = service.createSession(42L, DESKTOP);

        service.signOut(session.id());

        assertThat(service.resolve(session.id())).isEmpty();
        verify(eventSink).info(eq(SecurityEvents.SESSION_SIGNED_OUT), anyMap());
    }
}
