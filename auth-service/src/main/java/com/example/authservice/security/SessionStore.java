package com.example.authservice.security;

import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.SessionFamily;
import com.example.authservice.entity.SessionFamily.RevokeReason;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence contract for session families and their refresh tokens.
 */
public interface SessionStore {

    /**
     * Persist a new family together with its first refresh token.
     */
    SessionFamily createFamily(String subjectId, RefreshToken firstToken, Instant expiresAt);

    Optional<SessionFamily> findFamily(String familyId);

    Optional<RefreshToken> findTokenByHash(String tokenHash);

    /**
     * True when the family is revoked or no longer exists.
     */
    boolean isRevoked(String familyId);

    /**
     * @return true if this call revoked the family, false if it was already revoked or unknown
     */
    boolean revokeFamily(String familyId, RevokeReason reason);

    int revokeAllForSubject(String subjectId, RevokeReason reason);

    int revokeOtherFamilies(String subjectId, String keepFamilyId, RevokeReason reason);

    /**
     * Atomically replace the family's current token: succeeds only if the family is not
     * revoked and its current token is still {@code presented}. On success the presented
     * token is marked consumed and {@code next} is stored.
     *
     * @return false when another caller rotated first or the family was revoked
     */
    boolean rotate(String familyId, RefreshToken presented, RefreshToken next, Instant familyExpiresAt);

    /**
     * Delete tokens and families whose expiry is before the cutoff.
     *
     * @return number of families deleted
     */
    int deleteExpired(Instant cutoff);
}
