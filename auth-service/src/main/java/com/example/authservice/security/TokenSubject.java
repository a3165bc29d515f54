package com.example.authservice.security;

import com.example.authservice.entity.Role;

/**
 * What an access token is issued for.
 */
public record TokenSubject(String subjectId, Role role, String organizationId, String sessionId) {
}
