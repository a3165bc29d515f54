package com.example.authservice.dto;

import com.example.authservice.security.Identity;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * The caller's resolved identity, as returned by GET /api/auth/me.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IdentityResponse(
    String subjectId,
    String role,
    String organizationId,
    boolean active,
    Instant issuedAt,
    Instant expiresAt
) {
    public static IdentityResponse from(Identity identity) {
        return new IdentityResponse(
            identity.subjectId(),
            identity.role().name(),
            identity.organizationId(),
            identity.active(),
            identity.issuedAt(),
            identity.expiresAt()
        );
    }
}
