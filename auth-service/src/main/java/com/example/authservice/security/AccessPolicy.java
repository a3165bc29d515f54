package com.example.authservice.security;

import com.example.authservice.entity.Role;
import com.example.authservice.exception.PolicyViolationException;
import com.example.authservice.security.AccessRuleTable.RouteMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;

import java.util.Map;
import java.util.Set;

/**
 * Decides whether a resolved identity may call a route.
 *
 * Evaluation order:
 * 1. public route: allow
 * 2. ADMIN on a rule that does not exclude admin: allow
 * 3. role not permitted: INSUFFICIENT_ROLE
 * 4. inactive account on a rule without allowInactive: DISABLED
 * 5. scoped rule and caller organization differs from the path variable: SCOPE_MISMATCH
 *
 * Pure function of its inputs; no I/O.
 */
@Slf4j
public class AccessPolicy {

    private final AccessRuleTable rules;

    public AccessPolicy(AccessRuleTable rules) {
        this.rules = rules;
    }

    public RouteMatch route(HttpMethod method, String path) {
        return rules.match(method, path);
    }

    /**
     * Role check without a route, for service-layer guards. Any one role suffices.
     */
    public AccessDecision authorize(Identity identity, Set<Role> requiredRoles) {
        if (identity.role() == Role.ADMIN) {
            return AccessDecision.allow();
        }
        if (!requiredRoles.contains(identity.role())) {
            return AccessDecision.deny(DenyReason.INSUFFICIENT_ROLE);
        }
        if (!identity.active()) {
            return AccessDecision.deny(DenyReason.DISABLED);
        }
        return AccessDecision.allow();
    }

    public AccessDecision authorize(Identity identity, AccessRule rule, Map<String, String> pathVariables) {
        if (rule.publicRoute()) {
            return AccessDecision.allow();
        }
        boolean adminOverride = switch (identity.role()) {
            case ADMIN -> !rule.adminExcluded();
            case COORDINATOR, PRINCIPAL, MENTOR, USER, SERVICE -> false;
        };
        if (adminOverride) {
            return AccessDecision.allow();
        }
        if (!rule.permittedRoles().contains(identity.role())) {
            return AccessDecision.deny(DenyReason.INSUFFICIENT_ROLE);
        }
        if (!identity.active() && !rule.allowInactive()) {
            return AccessDecision.deny(DenyReason.DISABLED);
        }
        if (rule.scopeVariable() != null) {
            String requested = pathVariables.get(rule.scopeVariable());
            if (identity.organizationId() == null || !identity.organizationId().equals(requested)) {
                return AccessDecision.deny(DenyReason.SCOPE_MISMATCH);
            }
        }
        return AccessDecision.allow();
    }

    /**
     * @throws PolicyViolationException when the matched rule denies the identity
     */
    public void enforce(Identity identity, RouteMatch match) {
        AccessDecision decision = authorize(identity, match.rule(), match.pathVariables());
        if (!decision.allowed()) {
            log.debug("Access denied: subject={} role={} route={} reason={}",
                    identity.subjectId(), identity.role(), match.rule().routeId(), decision.reason());
            throw new PolicyViolationException(decision.reason(), match.rule().routeId());
        }
    }
}
