package com.kaimu.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.kaimu.backend.modules.auth.domain.RefreshToken;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select rt from RefreshToken rt where rt.tokenHash = :tokenHash")
    Optional<RefreshToken> findByTokenHashForUpdate(@Param("tokenHash") String tokenHash);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshToken rt
               set rt.revokedAt = :revokedAt
             where rt.userId = :userId
               and rt.revokedAt is null
            """)
    int revokeAllActiveForUser(@Param("userId") UUID userId,
                               @Param("revokedAt") OffsetDateTime revokedAt);

    @Query("""
            select rt
              from RefreshToken rt
             where rt.userId = :userId
               and rt.revokedAt is null
               and rt.expiresAt > :now
             order by rt.createdAt desc
            """)
    List<RefreshToken> findActiveByUserId(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);
}
