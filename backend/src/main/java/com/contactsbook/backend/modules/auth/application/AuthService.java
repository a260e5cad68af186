package com.contactsbook.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.contactsbook.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.contactsbook.backend.modules.auth.domain.AppUser;
import com.contactsbook.backend.modules.auth.domain.RefreshToken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Authentication and session lifecycle: credentials, access and refresh token issuance,
 * validation, rotation and revocation, plus the email confirmation and password reset flows.
 * <p>
 * The session cache is consulted first and the user directory / refresh token store are the
 * source of truth. Cache outages never fail an operation; an unreadable denylist is handled by
 * the configured {@link DenylistFailurePolicy}.
 */
@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    private static final String INVALID_REFRESH_TOKEN = "INVALID_REFRESH_TOKEN";
    private static final String USER_NOT_FOUND = "USER_NOT_FOUND";

    private final UserDirectory userDirectory;
    private final RefreshTokenStore refreshTokenStore;
    private final PasswordHasher passwordHasher;
    private final TokenHasher tokenHasher;
    private final JwtTokenService jwtTokenService;
    private final SessionCache sessionCache;
    private final AvatarLookup avatarLookup;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;
    private final Duration userSnapshotTtl;
    private final DenylistFailurePolicy denylistFailurePolicy;

    public AuthService(
            UserDirectory userDirectory,
            RefreshTokenStore refreshTokenStore,
            PasswordHasher passwordHasher,
            TokenHasher tokenHasher,
            JwtTokenService jwtTokenService,
            SessionCache sessionCache,
            AvatarLookup avatarLookup,
            NotificationDispatcher notificationDispatcher,
            Clock clock,
            @Value("${auth.cache.user-ttl:1h}") Duration userSnapshotTtl,
            @Value("${auth.cache.denylist-failure-policy:FAIL_OPEN}") DenylistFailurePolicy denylistFailurePolicy
    ) {
        this.userDirectory = userDirectory;
        this.refreshTokenStore = refreshTokenStore;
        this.passwordHasher = passwordHasher;
        this.tokenHasher = tokenHasher;
        this.jwtTokenService = jwtTokenService;
        this.sessionCache = sessionCache;
        this.avatarLookup = avatarLookup;
        this.notificationDispatcher = notificationDispatcher;
        this.clock = clock;
        this.userSnapshotTtl = userSnapshotTtl;
        this.denylistFailurePolicy = denylistFailurePolicy;
    }

    /**
     * Unknown username, wrong password and unconfirmed email all fail with the same
     * {@code INVALID_CREDENTIALS} code.
     */
    public AppUser authenticate(String username, String password) {
        AppUser user = userDirectory.findByUsername(username)
                .orElseThrow(() -> AuthException.unauthorized(INVALID_CREDENTIALS));

        if (!passwordHasher.verify(password, user.getPasswordHash())) {
            throw AuthException.unauthorized(INVALID_CREDENTIALS);
        }
        if (!user.isConfirmed()) {
            log.debug("Login rejected for unconfirmed user id={}", user.getId());
            throw AuthException.unauthorized(INVALID_CREDENTIALS);
        }

        sessionCache.putUserSnapshot(UserSnapshot.from(user), userSnapshotTtl);
        return user;
    }

    /**
     * Creates an unconfirmed account and dispatches an email verification token. The existence
     * checks only produce a friendlier error; the unique constraints of the store decide.
     */
    public AppUser register(UserRegistration registration) {
        if (userDirectory.existsByUsername(registration.username())) {
            throw AuthException.conflict("USERNAME_TAKEN", "User already exists");
        }
        if (userDirectory.existsByEmail(registration.email())) {
            throw AuthException.conflict("EMAIL_TAKEN", "Email already exists");
        }

        String avatar = resolveAvatar(registration.email());
        String passwordHash = passwordHasher.hash(registration.password());
        AppUser user = userDirectory.create(registration, passwordHash, avatar);
        log.info("Registered user id={} username={}", user.getId(), user.getUsername());

        dispatchVerification(user);
        return user;
    }

    @Transactional(readOnly = true)
    public String issueAccessToken(String username) {
        return jwtTokenService.issueAccessToken(username);
    }

    /**
     * @return the raw refresh token; only its digest is persisted
     */
    public String issueRefreshToken(Long userId, String ipAddress, String userAgent) {
        String rawToken = tokenHasher.generate();
        OffsetDateTime expiredAt = OffsetDateTime.now(clock).plus(jwtTokenService.getRefreshTokenTtl());
        refreshTokenStore.save(userId, tokenHasher.hash(rawToken), expiredAt, ipAddress, userAgent);
        return rawToken;
    }

    /**
     * Runs outside any transaction: a cache hit never touches the database, and a miss reads
     * through {@link UserDirectory} in its own read-only transaction.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public UserSnapshot validateAccessToken(String token) {
        if (token == null || token.isBlank()) {
            throw AuthException.invalidToken(JwtTokenService.CODE_INVALID_TOKEN);
        }

        DenylistStatus denylistStatus = sessionCache.checkDenylist(token);
        if (denylistStatus == DenylistStatus.LISTED) {
            throw AuthException.revoked();
        }
        if (denylistStatus == DenylistStatus.UNKNOWN && denylistFailurePolicy == DenylistFailurePolicy.FAIL_CLOSED) {
            log.warn("Denylist unavailable, rejecting access token (policy={})", denylistFailurePolicy);
            throw AuthException.revoked();
        }

        ParsedToken parsed = jwtTokenService.decodeAndValidate(token);
        if (parsed.type() != null) {
            throw AuthException.invalidToken("INVALID_TOKEN_TYPE");
        }
        String username = parsed.subject();

        Optional<UserSnapshot> cached = sessionCache.getUserSnapshot(username);
        if (cached.isPresent()) {
            return cached.get();
        }

        AppUser user = userDirectory.findByUsername(username)
                .orElseThrow(() -> AuthException.unauthorized("COULD_NOT_VALIDATE_CREDENTIALS"));
        UserSnapshot snapshot = UserSnapshot.from(user);
        sessionCache.putUserSnapshot(snapshot, userSnapshotTtl);
        return snapshot;
    }

    /**
     * A missing, revoked or expired token and a token whose owner no longer exists fail alike.
     */
    @Transactional(readOnly = true)
    public AppUser validateRefreshToken(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            throw AuthException.invalidToken(INVALID_REFRESH_TOKEN);
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        RefreshToken record = refreshTokenStore.findActive(tokenHasher.hash(rawToken), now)
                .orElseThrow(() -> AuthException.invalidToken(INVALID_REFRESH_TOKEN));
        return userDirectory.findById(record.getUser().getId())
                .orElseThrow(() -> AuthException.invalidToken(INVALID_REFRESH_TOKEN));
    }

    /**
     * Idempotent: unknown and already revoked tokens are ignored.
     */
    public void revokeRefreshToken(String rawToken) {
        if (rawToken == null || rawToken.isBlank()) {
            return;
        }
        refreshTokenStore.findByHash(tokenHasher.hash(rawToken))
                .filter(record -> !record.isRevoked())
                .ifPresent(record -> {
                    refreshTokenStore.revoke(record, OffsetDateTime.now(clock));
                    log.info("Revoked refresh token id={} user={}", record.getId(), record.getUser().getId());
                });
    }

    /**
     * Denylists the token for the rest of its lifetime. An already expired token is left alone.
     */
    public void revokeAccessToken(String token) {
        ParsedToken parsed;
        try {
            parsed = jwtTokenService.decodeAndValidate(token);
        } catch (AuthException ex) {
            if (JwtTokenService.CODE_TOKEN_EXPIRED.equals(ex.getCode())) {
                log.debug("Skipping revocation of an expired access token");
                return;
            }
            throw ex;
        }

        Duration remaining = parsed.remainingLifetime(clock.instant());
        if (remaining.isZero() || remaining.isNegative()) {
            return;
        }
        if (!sessionCache.denylist(token, remaining)) {
            log.warn("Access token revocation for subject={} was not recorded; it stays valid until {}",
                    parsed.subject(), parsed.expiresAt());
        }
    }

    @Transactional(readOnly = true)
    public String createPasswordResetToken(String email) {
        AppUser user = userDirectory.findByEmail(email)
                .orElseThrow(() -> AuthException.notFound(USER_NOT_FOUND));
        return jwtTokenService.issuePasswordResetToken(user.getEmail());
    }

    /**
     * Sets a new password for the account. The caller has already verified a password reset
     * token for {@code email}. All refresh tokens of the user are revoked.
     */
    public AppUser resetPassword(String email, String newPassword) {
        AppUser user = userDirectory.findByEmail(email)
                .orElseThrow(() -> AuthException.notFound(USER_NOT_FOUND));

        AppUser updated = userDirectory.setPasswordHash(user, passwordHasher.hash(newPassword));
        sessionCache.evictUserSnapshot(updated.getUsername());
        int revoked = refreshTokenStore.revokeAllForUser(updated.getId(), OffsetDateTime.now(clock));
        log.info("Password reset for user id={}, revoked {} refresh tokens", updated.getId(), revoked);
        return updated;
    }

    public TokenPair login(String username, String password, String ipAddress, String userAgent) {
        AppUser user = authenticate(username, password);
        return issueTokenPair(user, ipAddress, userAgent);
    }

    /**
     * Exchanges a refresh token for a new pair. The presented token is revoked.
     */
    public TokenPair refresh(String rawRefreshToken, String ipAddress, String userAgent) {
        AppUser user = validateRefreshToken(rawRefreshToken);
        revokeRefreshToken(rawRefreshToken);
        return issueTokenPair(user, ipAddress, userAgent);
    }

    /**
     * The refresh token is always revoked. An access token that no longer decodes is left to
     * expire on its own.
     */
    public void logout(String accessToken, String rawRefreshToken) {
        revokeRefreshToken(rawRefreshToken);
        if (accessToken == null || accessToken.isBlank()) {
            return;
        }
        try {
            revokeAccessToken(accessToken);
        } catch (AuthException ex) {
            log.debug("Access token not denylisted at logout: {}", ex.getCode());
        }
    }

    @Transactional(readOnly = true)
    public String createEmailVerificationToken(String email) {
        AppUser user = userDirectory.findByEmail(email)
                .orElseThrow(() -> AuthException.notFound(USER_NOT_FOUND));
        return jwtTokenService.issueEmailVerificationToken(user.getEmail());
    }

    @Transactional(readOnly = true)
    public EmailConfirmationStatus requestEmailVerification(String email) {
        AppUser user = userDirectory.findByEmail(email)
                .orElseThrow(() -> AuthException.notFound(USER_NOT_FOUND));
        if (user.isConfirmed()) {
            return EmailConfirmationStatus.ALREADY_CONFIRMED;
        }
        dispatchVerification(user);
        return EmailConfirmationStatus.VERIFICATION_SENT;
    }

    public EmailConfirmationStatus confirmEmail(String verificationToken) {
        ParsedToken parsed = jwtTokenService.decodeTyped(verificationToken, JwtTokenService.TYPE_EMAIL_VERIFICATION);
        AppUser user = userDirectory.findByEmail(parsed.subject())
                .orElseThrow(() -> AuthException.notFound("VERIFICATION_ERROR"));
        if (user.isConfirmed()) {
            return EmailConfirmationStatus.ALREADY_CONFIRMED;
        }
        AppUser confirmed = userDirectory.setConfirmed(user.getEmail());
        sessionCache.evictUserSnapshot(confirmed.getUsername());
        log.info("Email confirmed for user id={}", confirmed.getId());
        return EmailConfirmationStatus.CONFIRMED;
    }

    @Transactional(readOnly = true)
    public void requestPasswordReset(String email) {
        String token = createPasswordResetToken(email);
        notificationDispatcher.sendPasswordReset(email, token);
    }

    public AppUser resetPasswordWithToken(String resetToken, String newPassword) {
        ParsedToken parsed = jwtTokenService.decodeTyped(resetToken, JwtTokenService.TYPE_PASSWORD_RESET);
        return resetPassword(parsed.subject(), newPassword);
    }

    public AppUser updateAvatar(String email, String avatarUrl) {
        AppUser user = userDirectory.setAvatar(email, avatarUrl);
        sessionCache.putUserSnapshot(UserSnapshot.from(user), userSnapshotTtl);
        return user;
    }

    private TokenPair issueTokenPair(AppUser user, String ipAddress, String userAgent) {
        String accessToken = issueAccessToken(user.getUsername());
        String refreshToken = issueRefreshToken(user.getId(), ipAddress, userAgent);
        return new TokenPair(
                accessToken,
                jwtTokenService.getAccessTokenTtl(),
                refreshToken,
                jwtTokenService.getRefreshTokenTtl()
        );
    }

    private String resolveAvatar(String email) {
        try {
            return avatarLookup.lookup(email).orElse(null);
        } catch (RuntimeException ex) {
            log.warn("Avatar lookup failed, registering without avatar: {}", ex.getMessage());
            return null;
        }
    }

    private void dispatchVerification(AppUser user) {
        try {
            String token = jwtTokenService.issueEmailVerificationToken(user.getEmail());
            notificationDispatcher.sendEmailVerification(user.getEmail(), user.getUsername(), token);
        } catch (RuntimeException ex) {
            log.warn("Verification dispatch failed for user id={}: {}", user.getId(), ex.getMessage());
        }
    }
}
