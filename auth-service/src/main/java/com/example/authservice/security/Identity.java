package com.example.authservice.security;

import com.example.authservice.entity.Role;

import java.time.Instant;
import java.util.Objects;

/**
 * Caller identity derived from an access token for one request. Never persisted.
 *
 * organizationId is the college scope (null for unscoped accounts); sessionId is the
 * session family the token was issued under; active is false for accounts that are not
 * yet activated.
 */
public record Identity(
        String subjectId,
        Role role,
        Instant issuedAt,
        Instant expiresAt,
        String organizationId,
        String sessionId,
        boolean active
) {
    public Identity {
        Objects.requireNonNull(subjectId, "subjectId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(issuedAt, "issuedAt must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("expiresAt must be after issuedAt");
        }
    }

    /**
     * Same token, with role, scope and activation taken from the stored user record.
     */
    public Identity withStoredState(Role storedRole, String storedOrganizationId, boolean storedActive) {
        return new Identity(subjectId, storedRole, issuedAt, expiresAt, storedOrganizationId, sessionId, storedActive);
    }
}
