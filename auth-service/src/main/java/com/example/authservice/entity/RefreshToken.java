package com.example.authservice.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * RefreshToken entity mapping to 'refresh_tokens' table.
 *
 * Stores the SHA-256 hash of the opaque token, never the token itself.
 * consumed = true once the token has been rotated; presenting it again is reuse.
 */
@Entity
@Table(name = "refresh_tokens", indexes = {
    @Index(name = "idx_refresh_token_hash", columnList = "token_hash"),
    @Index(name = "idx_refresh_family_id", columnList = "family_id"),
    @Index(name = "idx_refresh_expires_at", columnList = "expires_at")
})
public class RefreshToken {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "family_id", nullable = false, length = 36)
    private String familyId;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64)
    private String tokenHash;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(nullable = false)
    private boolean consumed = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // Default constructor (JPA requirement)
    protected RefreshToken() {
    }

    public RefreshToken(String id, String familyId, String tokenHash, Instant createdAt, Instant expiresAt) {
        this.id = id;
        this.familyId = familyId;
        this.tokenHash = tokenHash;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getId() {
        return id;
    }

    public String getFamilyId() {
        return familyId;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public boolean isConsumed() {
        return consumed;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Check if token is expired at the given instant.
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(this.expiresAt);
    }

    public void markConsumed() {
        this.consumed = true;
    }
}
