package com.example.authservice.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * One login session: the lineage of refresh tokens rotated from a single login.
 *
 * Revocation is the only mutation besides rotation; rows are removed by the expiry sweep only.
 * current_token_id is the compare-and-set target of refresh-token rotation.
 */
@Entity
@Table(name = "session_families", indexes = {
    @Index(name = "idx_session_subject", columnList = "subject_id"),
    @Index(name = "idx_session_expires_at", columnList = "expires_at")
})
public class SessionFamily {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "subject_id", nullable = false, length = 36)
    private String subjectId;

    @Column(name = "current_token_id", nullable = false, length = 36)
    private String currentTokenId;

    @Column(nullable = false)
    private boolean revoked = false;

    @Column(name = "revoke_reason", length = 30)
    @Enumerated(EnumType.STRING)
    private RevokeReason revokeReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // End of the family's validity; extended on every rotation
    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    public enum RevokeReason {
        LOGOUT,
        LOGOUT_ALL,
        REUSE_DETECTED,
        SINGLE_SESSION,
        PASSWORD_CHANGE,
        ACCOUNT_DISABLED
    }

    // Default constructor (JPA requirement)
    protected SessionFamily() {
    }

    public SessionFamily(String id, String subjectId, String currentTokenId, Instant createdAt, Instant expiresAt) {
        this.id = id;
        this.subjectId = subjectId;
        this.currentTokenId = currentTokenId;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getId() {
        return id;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getCurrentTokenId() {
        return currentTokenId;
    }

    public boolean isRevoked() {
        return revoked;
    }

    public RevokeReason getRevokeReason() {
        return revokeReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * Revoke this family. Keeps the first reason if already revoked.
     */
    public void revoke(RevokeReason reason) {
        if (!this.revoked) {
            this.revoked = true;
            this.revokeReason = reason;
        }
    }
}
