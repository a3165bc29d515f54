package com.example.authservice.repository;

import com.example.authservice.entity.SessionFamily;
import com.example.authservice.entity.SessionFamily.RevokeReason;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for SessionFamily entity.
 *
 * All state changes are conditional bulk updates so that concurrent requests never
 * overwrite each other's revocation or rotation.
 */
@Repository
public interface SessionFamilyRepository extends JpaRepository<SessionFamily, String> {

    /**
     * Revocation flag only; checked on every authenticated request.
     */
    @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = "2000"))
    @Query("SELECT f.revoked FROM SessionFamily f WHERE f.id = :familyId")
    Optional<Boolean> findRevokedFlag(@Param("familyId") String familyId);

    /**
     * Compare-and-set of the family's current refresh token.
     *
     * @return 1 if this caller won the rotation, 0 if the token was already rotated or the family revoked
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SessionFamily f SET f.currentTokenId = :nextTokenId, f.expiresAt = :expiresAt " +
           "WHERE f.id = :familyId AND f.currentTokenId = :expectedTokenId AND f.revoked = false")
    int compareAndSetCurrentToken(@Param("familyId") String familyId,
                                  @Param("expectedTokenId") String expectedTokenId,
                                  @Param("nextTokenId") String nextTokenId,
                                  @Param("expiresAt") Instant expiresAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SessionFamily f SET f.revoked = true, f.revokeReason = :reason " +
           "WHERE f.id = :familyId AND f.revoked = false")
    int revokeById(@Param("familyId") String familyId, @Param("reason") RevokeReason reason);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SessionFamily f SET f.revoked = true, f.revokeReason = :reason " +
           "WHERE f.subjectId = :subjectId AND f.revoked = false")
    int revokeAllBySubject(@Param("subjectId") String subjectId, @Param("reason") RevokeReason reason);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SessionFamily f SET f.revoked = true, f.revokeReason = :reason " +
           "WHERE f.subjectId = :subjectId AND f.id <> :keepFamilyId AND f.revoked = false")
    int revokeAllBySubjectExcept(@Param("subjectId") String subjectId,
                                 @Param("keepFamilyId") String keepFamilyId,
                                 @Param("reason") RevokeReason reason);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM SessionFamily f WHERE f.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
