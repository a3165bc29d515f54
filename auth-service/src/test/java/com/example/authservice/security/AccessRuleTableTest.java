package com.example.authservice.security;

import com.example.authservice.entity.Role;
import com.example.authservice.security.AccessRuleTable.RouteMatch;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.example.authservice.security.AccessRule.authenticated;
import static com.example.authservice.security.AccessRule.publicRoute;
import static com.example.authservice.security.AccessRule.route;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.http.HttpMethod.DELETE;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.HEAD;
import static org.springframework.http.HttpMethod.POST;

class AccessRuleTableTest {

    @Test
    void mostSpecificPatternWinsRegardlessOfRegistrationOrder() {
        AccessRuleTable table = AccessRuleTable.builder()
                .rule(route(null, "/api/admin/**", Role.ADMIN))
                .rule(route(GET, "/api/admin/colleges/{collegeId}/details", Role.PRINCIPAL).scopedBy("collegeId"))
                .build();

        RouteMatch details = table.match(GET, "/api/admin/colleges/c-1/details");
        assertEquals("GET /api/admin/colleges/{collegeId}/details", details.rule().routeId());
        assertEquals(Map.of("collegeId", "c-1"), details.pathVariables());

        RouteMatch other = table.match(GET, "/api/admin/users");
        assertEquals("* /api/admin/**", other.rule().routeId());
        assertTrue(other.pathVariables().isEmpty());
    }

    @Test
    void methodBoundRuleBeatsMethodAgnosticRuleWithSamePattern() {
        AccessRuleTable table = AccessRuleTable.builder()
                .rule(route(null, "/api/reports", Role.COORDINATOR))
                .rule(route(GET, "/api/reports", Role.MENTOR))
                .build();

        assertEquals(Role.MENTOR, table.match(GET, "/api/reports").rule().permittedRoles().iterator().next());
        assertEquals(Role.COORDINATOR, table.match(POST, "/api/reports").rule().permittedRoles().iterator().next());
    }

    @Test
    void ruleForAnotherMethodDoesNotMatch() {
        AccessRuleTable table = AccessRuleTable.builder()
                .rule(publicRoute(POST, "/api/auth/login"))
                .build();

        RouteMatch match = table.match(GET, "/api/auth/login");

        assertTrue(match.isDefaultDeny());
        assertFalse(match.rule().publicRoute());
    }

    @Test
    void headMatchesGetRule() {
        AccessRuleTable table = AccessRuleTable.builder()
                .rule(publicRoute(GET, "/actuator/health"))
                .rule(route(GET, "/api/reports", Role.MENTOR))
                .rule(route(POST, "/api/reports", Role.COORDINATOR))
                .build();

        assertTrue(table.match(HEAD, "/actuator/health").rule().publicRoute());
        assertEquals("GET /api/reports", table.match(HEAD, "/api/reports").rule().routeId());
    }

    @Test
    void headDoesNotMatchOtherMethods() {
        AccessRuleTable table = AccessRuleTable.builder()
                .rule(publicRoute(POST, "/api/auth/login"))
                .build();

        assertTrue(table.match(HEAD, "/api/auth/login").isDefaultDeny());
    }

    @Test
    void unregisteredPathFallsBackToDefaultDeny() {
        AccessRuleTable table = AccessRuleTable.builder()
                .rule(authenticated(GET, "/api/notifications"))
                .build();

        RouteMatch match = table.match(DELETE, "/api/unknown/thing");

        assertTrue(match.isDefaultDeny());
        assertSame(AccessRuleTable.DEFAULT_DENY, match.rule());
        assertTrue(match.rule().permittedRoles().isEmpty());
    }

    @Test
    void trailingSlashIsADifferentPath() {
        AccessRuleTable table = AccessRuleTable.builder()
                .rule(authenticated(GET, "/api/auth/me"))
                .build();

        assertFalse(table.match(GET, "/api/auth/me").isDefaultDeny());
        assertTrue(table.match(GET, "/api/auth/me/").isDefaultDeny());
    }

    @Test
    void rejectsRuleThatPermitsAndExcludesAdmin() {
        AccessRuleTable.Builder builder = AccessRuleTable.builder();

        assertThrows(IllegalStateException.class,
                () -> builder.rule(route(POST, "/api/notifications/dispatch", Role.ADMIN, Role.SERVICE).excludeAdmin()));
    }

    @Test
    void rejectsNonPublicRuleWithoutRoles() {
        AccessRuleTable.Builder builder = AccessRuleTable.builder();

        assertThrows(IllegalStateException.class, () -> builder.rule(route(GET, "/api/nobody")));
    }

    @Test
    void rejectsDuplicateRoute() {
        AccessRuleTable.Builder builder = AccessRuleTable.builder()
                .rule(route(GET, "/api/ideas/**", Role.USER));

        assertThrows(IllegalStateException.class, () -> builder.rule(route(GET, "/api/ideas/**", Role.MENTOR)));
    }

    @Test
    void rejectsScopeOnUnknownPathVariable() {
        AccessRuleTable.Builder builder = AccessRuleTable.builder();

        assertThrows(IllegalStateException.class,
                () -> builder.rule(route(GET, "/api/colleges/{id}", Role.PRINCIPAL).scopedBy("collegeId")));
    }

    @Test
    void rejectsScopedPublicRoute() {
        AccessRuleTable.Builder builder = AccessRuleTable.builder();

        assertThrows(IllegalStateException.class,
                () -> builder.rule(publicRoute(GET, "/api/colleges/{collegeId}").scopedBy("collegeId")));
    }

    @Test
    void rejectsInvalidPattern() {
        AccessRuleTable.Builder builder = AccessRuleTable.builder();

        assertThrows(IllegalStateException.class, () -> builder.rule(route(GET, "/api/**/ideas", Role.USER)));
        assertThrows(IllegalArgumentException.class, () -> route(GET, "api/ideas", Role.USER));
    }

    @Test
    void platformTableBuilds() {
        AccessRuleTable table = new com.example.authservice.config.AccessRulesConfig().accessRuleTable();

        assertFalse(table.rules().isEmpty());
        assertTrue(table.match(POST, "/api/auth/login").rule().publicRoute());
    }
}
