package com.clocked.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.clocked.backend.modules.auth.domain.RefreshToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    /**
     * Flips {@code revoked} for a single row. Returns 1 only for the caller that performed the
     * transition, so concurrent rotations of the same token cannot both proceed.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshToken rt
               set rt.revoked = true,
                   rt.revokedAt = :revokedAt,
                   rt.revokedReason = :reason
             where rt.id = :id
               and rt.revoked = false
            """)
    int revokeIfActive(@Param("id") UUID id,
                       @Param("revokedAt") OffsetDateTime revokedAt,
                       @Param("reason") String reason);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshToken rt
               set rt.revoked = true,
                   rt.revokedAt = :revokedAt,
                   rt.revokedReason = :reason
             where rt.userId = :userId
               and rt.revoked = false
            """)
    int revokeAllForUser(@Param("userId") UUID userId,
                         @Param("revokedAt") OffsetDateTime revokedAt,
                         @Param("reason") String reason);
}
