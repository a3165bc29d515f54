package com.example.authservice.security;

import com.example.authservice.entity.Role;

/**
 * Read-only view of a stored user as seen by the identity resolver.
 */
public record UserRecord(String id, Role role, boolean disabled, boolean active, String organizationId) {
}
