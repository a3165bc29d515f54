package com.example.authservice.security;

import com.example.authservice.entity.Role;
import org.springframework.http.HttpMethod;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Declarative access requirement for one route.
 *
 * method: null matches every HTTP method.
 * pattern: Spring PathPattern, e.g. /api/admin/colleges/{collegeId}/details.
 * permittedRoles: roles allowed in; ADMIN passes every rule unless adminExcluded.
 * publicRoute: no identity required; a valid token is still attached when present.
 * allowInactive: not-yet-activated accounts may call the route (first password change).
 * allowRevokedSession: a token whose session was already revoked is still accepted (logout).
 * scopeVariable: path variable that must equal the caller's organization.
 */
public record AccessRule(
        HttpMethod method,
        String pattern,
        Set<Role> permittedRoles,
        boolean publicRoute,
        boolean adminExcluded,
        boolean allowInactive,
        boolean allowRevokedSession,
        String scopeVariable
) {

    public AccessRule {
        if (pattern == null || !pattern.startsWith("/")) {
            throw new IllegalArgumentException("Route pattern must start with '/': " + pattern);
        }
        permittedRoles = permittedRoles.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(permittedRoles));
    }

    /**
     * Route restricted to the given roles (plus ADMIN via override).
     */
    public static AccessRule route(HttpMethod method, String pattern, Role... roles) {
        Set<Role> permitted = EnumSet.noneOf(Role.class);
        permitted.addAll(Arrays.asList(roles));
        return new AccessRule(method, pattern, permitted, false, false, false, false, null);
    }

    /**
     * Route that needs no identity.
     */
    public static AccessRule publicRoute(HttpMethod method, String pattern) {
        return new AccessRule(method, pattern, Set.of(), true, false, false, false, null);
    }

    /**
     * Route open to any authenticated caller.
     */
    public static AccessRule authenticated(HttpMethod method, String pattern) {
        return new AccessRule(method, pattern, EnumSet.allOf(Role.class), false, false, false, false, null);
    }

    public AccessRule excludeAdmin() {
        return new AccessRule(method, pattern, permittedRoles, publicRoute, true, allowInactive,
                allowRevokedSession, scopeVariable);
    }

    public AccessRule permitInactive() {
        return new AccessRule(method, pattern, permittedRoles, publicRoute, adminExcluded, true,
                allowRevokedSession, scopeVariable);
    }

    public AccessRule permitRevokedSession() {
        return new AccessRule(method, pattern, permittedRoles, publicRoute, adminExcluded, allowInactive,
                true, scopeVariable);
    }

    public AccessRule scopedBy(String pathVariable) {
        return new AccessRule(method, pattern, permittedRoles, publicRoute, adminExcluded, allowInactive,
                allowRevokedSession, pathVariable);
    }

    /**
     * Stable identifier used in logs and audit rows, e.g. "GET /api/auth/me" or "* /api/coordinator/**".
     */
    public String routeId() {
        return (method == null ? "*" : method.name()) + " " + pattern;
    }
}
