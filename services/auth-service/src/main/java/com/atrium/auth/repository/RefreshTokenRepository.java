package com.atrium.auth.repository;

import com.atrium.auth.entity.RefreshToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * RefreshTokenRepository - Data Access Layer for refresh credentials.
 *
 * Every lookup and mutation is a single statement so that a renewal racing a
 * revocation can never observe a half-applied state.
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    /**
     * Find the owner of a live credential: not revoked and not yet expired.
     *
     * @param tokenHash SHA-256 hex of the presented secret
     * @param now Current instant
     * @return the owning user id, or empty when absent, revoked or expired
     */
    @Query("select r.userId from RefreshToken r "
            + "where r.tokenHash = :tokenHash and r.revoked = false and r.expiresAt > :now")
    Optional<UUID> findLiveOwner(@Param("tokenHash") String tokenHash, @Param("now") Instant now);

    /**
     * Revoke a credential by hash. Idempotent: revoking an already revoked row
     * still matches it and leaves it revoked.
     *
     * @return number of rows matched (0 or 1)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update RefreshToken r set r.revoked = true where r.tokenHash = :tokenHash")
    int revokeByHash(@Param("tokenHash") String tokenHash);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update RefreshToken r set r.revoked = true where r.userId = :userId and r.revoked = false")
    int revokeAllByUserId(@Param("userId") UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RefreshToken r where r.userId = :userId")
    int deleteAllByUserId(@Param("userId") UUID userId);

    long countByUserId(UUID userId);
}
