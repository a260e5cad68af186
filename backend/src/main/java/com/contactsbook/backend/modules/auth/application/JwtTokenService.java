package com.contactsbook.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import com.contactsbook.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies signed bearer tokens. Verification is a pure function of the token, the
 * signing key and the clock; no store is consulted.
 * <p>
 * Plain access tokens carry no {@code type} claim. Password-reset and email-verification tokens
 * reuse the same codec with a {@code type} discriminator and their own lifetimes.
 */
@Service
public class JwtTokenService {

    public static final String TYPE_CLAIM = "type";
    public static final String TYPE_PASSWORD_RESET = "password_reset";
    public static final String TYPE_EMAIL_VERIFICATION = "email_verification";

    public static final String CODE_INVALID_TOKEN = "INVALID_TOKEN";
    public static final String CODE_TOKEN_EXPIRED = "TOKEN_EXPIRED";

    static final Duration PASSWORD_RESET_TTL = Duration.ofHours(1);
    static final Duration EMAIL_VERIFICATION_TTL = Duration.ofDays(7);

    private final JwtTokenProvider tokenProvider;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.access-token-ttl:15}") long accessTokenTtlMinutes,
            @Value("${jwt.refresh-token-ttl:7}") long refreshTokenTtlDays,
            Clock clock
    ) {
        if (accessTokenTtlMinutes <= 0 || refreshTokenTtlDays <= 0) {
            throw new IllegalStateException("jwt.access-token-ttl and jwt.refresh-token-ttl must be positive");
        }
        this.tokenProvider = tokenProvider;
        this.accessTokenTtl = Duration.ofMinutes(accessTokenTtlMinutes);
        this.refreshTokenTtl = Duration.ofDays(refreshTokenTtlDays);
        this.clock = clock;
    }

    public String issueAccessToken(String username) {
        return issue(username, null, accessTokenTtl);
    }

    public String issuePasswordResetToken(String email) {
        return issue(email, TYPE_PASSWORD_RESET, PASSWORD_RESET_TTL);
    }

    public String issueEmailVerificationToken(String email) {
        return issue(email, TYPE_EMAIL_VERIFICATION, EMAIL_VERIFICATION_TTL);
    }

    public String issue(String subject, String type, Duration ttl) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        Instant now = clock.instant();
        JwtBuilder builder = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(subject)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)));
        if (type != null) {
            builder.claim(TYPE_CLAIM, type);
        }
        return builder.signWith(tokenProvider.getSecretKey(), tokenProvider.getAlgorithm()).compact();
    }

    /**
     * @throws AuthException of kind {@link AuthErrorKind#INVALID_TOKEN} when the token is blank,
     *                       malformed, badly signed, expired or has no subject
     */
    public ParsedToken decodeAndValidate(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw AuthException.invalidToken(CODE_TOKEN_EXPIRED, e);
        } catch (JwtException | IllegalArgumentException e) {
            throw AuthException.invalidToken(CODE_INVALID_TOKEN, e);
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank() || claims.getExpiration() == null) {
            throw AuthException.invalidToken(CODE_INVALID_TOKEN);
        }
        Instant expiresAt = claims.getExpiration().toInstant();
        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null;
        return new ParsedToken(subject, claims.get(TYPE_CLAIM, String.class), issuedAt, expiresAt);
    }

    /**
     * Decodes a token and requires its {@code type} claim to equal {@code expectedType}.
     */
    public ParsedToken decodeTyped(String token, String expectedType) {
        ParsedToken parsed = decodeAndValidate(token);
        if (!expectedType.equals(parsed.type())) {
            throw AuthException.invalidToken("INVALID_TOKEN_TYPE");
        }
        return parsed;
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public Duration getRefreshTokenTtl() {
        return refreshTokenTtl;
    }

    public record ParsedToken(String subject, String type, Instant issuedAt, Instant expiresAt) {

        public Duration remainingLifetime(Instant now) {
            return Duration.between(now, expiresAt);
        }
    }
}
