package com.contactsbook.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.contactsbook.backend.modules.auth.domain.RefreshToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    @Query("""
            select rt
              from RefreshToken rt
             where rt.tokenHash = :tokenHash
               and rt.revokedAt is null
               and rt.expiredAt > :now
            """)
    Optional<RefreshToken> findActiveByTokenHash(@Param("tokenHash") String tokenHash,
                                                 @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            update RefreshToken rt
               set rt.revokedAt = :revokedAt
             where rt.user.id = :userId
               and rt.revokedAt is null
               and rt.expiredAt > :revokedAt
            """)
    int revokeActiveByUserId(@Param("userId") Long userId,
                             @Param("revokedAt") OffsetDateTime revokedAt);
}
