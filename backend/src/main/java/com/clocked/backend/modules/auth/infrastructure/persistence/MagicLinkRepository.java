package com.clocked.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.clocked.backend.modules.auth.domain.MagicLink;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MagicLinkRepository extends JpaRepository<MagicLink, String> {

    /**
     * Test-and-set in a single statement: returns 1 only for the one caller that consumed a
     * still-valid link.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update MagicLink ml
               set ml.used = true,
                   ml.usedAt = :now
             where ml.token = :token
               and ml.used = false
               and ml.expiresAt > :now
            """)
    int markUsed(@Param("token") String token, @Param("now") OffsetDateTime now);

    @Modifying
    @Query("delete from MagicLink ml where ml.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") OffsetDateTime cutoff);
}
