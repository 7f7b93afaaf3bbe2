package com.fellowship.auth.token;

import com.fellowship.auth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HmacTokenCodecTest {

    private static final byte[] KEY = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8);
    private static final Duration MAX_AGE = Duration.ofMinutes(30);

    private MutableClock clock;
    private HmacTokenCodec codec;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-15T08:00:00Z"));
        codec = new HmacTokenCodec(KEY, MAX_AGE, clock);
    }

    @Test
    void issuedToken_isValidImmediately() {
        String token = codec.issue();

        assertThat(codec.verify(token)).isEqualTo(TokenStatus.VALID);
        assertThat(codec.isValid(token)).isTrue();
    }

    @Test
    void issuedToken_hasThreeLowercaseHexSegments() {
        String[] parts = codec.issue().split("\\.");

        assertThat(parts).hasSize(3);
        assertThat(parts[0]).matches("[0-9a-f]{64}");
        assertThat(parts[1]).isEqualTo(Long.toHexString(clock.millis()));
        assertThat(parts[2]).matches("[0-9a-f]{32}");
    }

    @Test
    void token_isStillValidAtExactlyMaxAge() {
        String token = codec.issue();
        clock.advance(MAX_AGE);

        assertThat(codec.verify(token)).isEqualTo(TokenStatus.VALID);
    }

    @Test
    void token_expiresAfterMaxAge_andStaysExpired() {
        String token = codec.issue();

        clock.advance(MAX_AGE.plusMillis(1));
        assertThat(codec.verify(token)).isEqualTo(TokenStatus.EXPIRED);

        clock.advance(Duration.ofDays(3));
        assertThat(codec.verify(token)).isEqualTo(TokenStatus.EXPIRED);
    }

    @Test
    void alteringAnySingleCharacter_invalidatesToken() {
        String token = codec.issue();

        for (int i = 0; i < token.length(); i++) {
            char original = token.charAt(i);
            if (original == '.') {
                continue;
            }
            char replacement = original == '0' ? '1' : '0';
            String tampered = token.substring(0, i) + replacement + token.substring(i + 1);

            assertThat(codec.verify(tampered))
                    .as("tampered at index %d", i)
                    .isNotEqualTo(TokenStatus.VALID);
        }
    }

    @Test
    void tokenSignedWithAnotherKey_isForged() {
        HmacTokenCodec other = new HmacTokenCodec("another-signing-key-0123456789ab".getBytes(StandardCharsets.UTF_8), MAX_AGE, clock);

        assertThat(codec.verify(other.issue())).isEqualTo(TokenStatus.FORGED);
    }

    @Test
    void malformedInputs_areRejectedWithoutThrowing() {
        String valid = codec.issue();

        assertThat(codec.verify(null)).isEqualTo(TokenStatus.MALFORMED);
        assertThat(codec.verify("")).isEqualTo(TokenStatus.MALFORMED);
        assertThat(codec.verify("not-a-token")).isEqualTo(TokenStatus.MALFORMED);
        assertThat(codec.verify("a.b.c")).isEqualTo(TokenStatus.MALFORMED);
        assertThat(codec.verify(valid + ".00")).isEqualTo(TokenStatus.MALFORMED);
        assertThat(codec.verify(valid.toUpperCase())).isEqualTo(TokenStatus.MALFORMED);
        assertThat(codec.verify(valid.replace(".", ".."))).isEqualTo(TokenStatus.MALFORMED);
    }

    @Test
    void issuedTokens_areUnique() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            tokens.add(codec.issue());
        }

        assertThat(tokens).hasSize(100);
    }

    @Test
    void shortKey_isRejected() {
        assertThatThrownBy(() -> new HmacTokenCodec(new byte[8], MAX_AGE, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
