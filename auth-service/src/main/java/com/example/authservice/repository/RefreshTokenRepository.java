package com.example.authservice.repository;

import com.example.authservice.entity.RefreshToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for RefreshToken entity.
 * Tokens are looked up by SHA-256 hash; the plain value is never stored.
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, String> {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RefreshToken t SET t.consumed = true WHERE t.id = :id")
    int markConsumed(@Param("id") String id);

    /**
     * Delete expired tokens, and every token of a family that expired.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RefreshToken t WHERE t.expiresAt < :cutoff " +
           "OR t.familyId IN (SELECT f.id FROM SessionFamily f WHERE f.expiresAt < :cutoff)")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
