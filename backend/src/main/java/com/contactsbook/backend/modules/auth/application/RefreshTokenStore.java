package com.contactsbook.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.contactsbook.backend.modules.auth.domain.RefreshToken;
import com.contactsbook.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.contactsbook.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistent refresh-token records keyed by token digest. A record is active while it is not
 * revoked and {@code now < expiredAt}.
 */
@Component
@Transactional
public class RefreshTokenStore {

    private static final int IP_ADDRESS_MAX_LENGTH = 64;
    private static final int USER_AGENT_MAX_LENGTH = 512;

    private final RefreshTokenRepository refreshTokenRepository;
    private final AppUserRepository appUserRepository;

    public RefreshTokenStore(RefreshTokenRepository refreshTokenRepository, AppUserRepository appUserRepository) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.appUserRepository = appUserRepository;
    }

    @Transactional(readOnly = true)
    public Optional<RefreshToken> findByHash(String tokenHash) {
        return refreshTokenRepository.findByTokenHash(tokenHash);
    }

    @Transactional(readOnly = true)
    public Optional<RefreshToken> findActive(String tokenHash, OffsetDateTime now) {
        return refreshTokenRepository.findActiveByTokenHash(tokenHash, now);
    }

    public RefreshToken save(Long userId, String tokenHash, OffsetDateTime expiredAt, String ipAddress, String userAgent) {
        RefreshToken token = new RefreshToken();
        token.setUser(appUserRepository.getReferenceById(userId));
        token.setTokenHash(tokenHash);
        token.setExpiredAt(expiredAt);
        token.setIpAddress(truncate(ipAddress, IP_ADDRESS_MAX_LENGTH));
        token.setUserAgent(truncate(userAgent, USER_AGENT_MAX_LENGTH));
        return refreshTokenRepository.save(token);
    }

    public RefreshToken revoke(RefreshToken token, OffsetDateTime revokedAt) {
        token.setRevokedAt(revokedAt);
        return refreshTokenRepository.save(token);
    }

    /**
     * @return number of previously active tokens that were revoked
     */
    public int revokeAllForUser(Long userId, OffsetDateTime revokedAt) {
        return refreshTokenRepository.revokeActiveByUserId(userId, revokedAt);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
