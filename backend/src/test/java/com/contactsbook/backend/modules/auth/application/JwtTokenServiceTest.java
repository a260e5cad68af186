package com.contactsbook.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

import com.contactsbook.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.contactsbook.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.contactsbook.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    static final String SECRET = "unit-test-signing-secret-0123456789abcdef";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private MutableClock clock;
    private JwtTokenService jwtTokenService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        jwtTokenService = new JwtTokenService(new JwtTokenProvider(SECRET, "HS256"), 15, 7, clock);
    }

    @Test
    void accessTokenCarriesSubjectAndConfiguredLifetime() {
        ParsedToken parsed = jwtTokenService.decodeAndValidate(jwtTokenService.issueAccessToken("alice"));

        assertThat(parsed.subject()).isEqualTo("alice");
        assertThat(parsed.type()).isNull();
        assertThat(parsed.issuedAt()).isEqualTo(NOW);
        assertThat(parsed.expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
        assertThat(parsed.remainingLifetime(NOW)).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    void expiredTokenIsRejectedWithExpiredCode() {
        String token = jwtTokenService.issueAccessToken("alice");
        clock.advance(Duration.ofMinutes(16));

        assertThatThrownBy(() -> jwtTokenService.decodeAndValidate(token))
                .isInstanceOfSatisfying(AuthException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(AuthErrorKind.INVALID_TOKEN);
                    assertThat(ex.getCode()).isEqualTo(JwtTokenService.CODE_TOKEN_EXPIRED);
                });
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        JwtTokenService other = new JwtTokenService(
                new JwtTokenProvider("another-signing-secret-0123456789abcdefgh", "HS256"), 15, 7, clock);
        String forged = other.issueAccessToken("alice");

        assertThatThrownBy(() -> jwtTokenService.decodeAndValidate(forged))
                .isInstanceOfSatisfying(AuthException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo(JwtTokenService.CODE_INVALID_TOKEN));
    }

    @Test
    void tamperedPayloadIsRejected() {
        String token = jwtTokenService.issueAccessToken("alice");
        String[] parts = token.split("\\.");
        String forgedPayload = Base64.getUrlEncoder().withoutPadding().encodeToString(
                "{\"sub\":\"mallory\",\"exp\":4102444800}".getBytes(StandardCharsets.UTF_8));
        String tampered = parts[0] + "." + forgedPayload + "." + parts[2];

        assertThatThrownBy(() -> jwtTokenService.decodeAndValidate(tampered))
                .isInstanceOf(AuthException.class);
    }

    @Test
    void garbageAndBlankTokensAreRejected() {
        assertThatThrownBy(() -> jwtTokenService.decodeAndValidate("not-a-jwt"))
                .isInstanceOfSatisfying(AuthException.class, ex ->
                        assertThat(ex.getKind()).isEqualTo(AuthErrorKind.INVALID_TOKEN));
        assertThatThrownBy(() -> jwtTokenService.decodeAndValidate(""))
                .isInstanceOfSatisfying(AuthException.class, ex ->
                        assertThat(ex.getKind()).isEqualTo(AuthErrorKind.INVALID_TOKEN));
    }

    @Test
    void passwordResetTokenIsTypedAndLivesOneHour() {
        String token = jwtTokenService.issuePasswordResetToken("alice@example.com");

        ParsedToken parsed = jwtTokenService.decodeTyped(token, JwtTokenService.TYPE_PASSWORD_RESET);
        assertThat(parsed.subject()).isEqualTo("alice@example.com");
        assertThat(parsed.expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
    }

    @Test
    void typedDecodingRejectsOtherTypes() {
        String verification = jwtTokenService.issueEmailVerificationToken("alice@example.com");
        String access = jwtTokenService.issueAccessToken("alice");

        assertThatThrownBy(() -> jwtTokenService.decodeTyped(verification, JwtTokenService.TYPE_PASSWORD_RESET))
                .isInstanceOfSatisfying(AuthException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo("INVALID_TOKEN_TYPE"));
        assertThatThrownBy(() -> jwtTokenService.decodeTyped(access, JwtTokenService.TYPE_EMAIL_VERIFICATION))
                .isInstanceOfSatisfying(AuthException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo("INVALID_TOKEN_TYPE"));
    }

    @Test
    void emailVerificationTokenLivesSevenDays() {
        clock.advance(Duration.ofDays(6));
        String token = jwtTokenService.issueEmailVerificationToken("alice@example.com");
        clock.advance(Duration.ofDays(6).plusHours(23));

        assertThat(jwtTokenService.decodeTyped(token, JwtTokenService.TYPE_EMAIL_VERIFICATION).subject())
                .isEqualTo("alice@example.com");
    }

    @Test
    void nonPositiveLifetimesAreRefusedAtStartup() {
        JwtTokenProvider provider = new JwtTokenProvider(SECRET, "HS256");

        assertThatThrownBy(() -> new JwtTokenService(provider, 0, 7, clock))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> jwtTokenService.issue("alice", null, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
