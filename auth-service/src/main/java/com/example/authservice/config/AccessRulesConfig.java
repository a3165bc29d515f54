package com.example.authservice.config;

import com.example.authservice.security.AccessRule;
import com.example.authservice.security.AccessRuleTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static com.example.authservice.entity.Role.ADMIN;
import static com.example.authservice.entity.Role.COORDINATOR;
import static com.example.authservice.entity.Role.MENTOR;
import static com.example.authservice.entity.Role.PRINCIPAL;
import static com.example.authservice.entity.Role.SERVICE;
import static com.example.authservice.entity.Role.USER;
import static com.example.authservice.security.AccessRule.authenticated;
import static com.example.authservice.security.AccessRule.publicRoute;
import static com.example.authservice.security.AccessRule.route;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.http.HttpMethod.PUT;

/**
 * Route access table for the platform.
 *
 * ADMIN passes every rule below except those marked excludeAdmin(). Any route not
 * listed is admin-only.
 */
@Configuration
@Slf4j
public class AccessRulesConfig {

    @Bean
    public AccessRuleTable accessRuleTable() {
        AccessRuleTable table = AccessRuleTable.builder()
                // Auth endpoints
                .rule(publicRoute(POST, "/api/auth/login"))
                .rule(publicRoute(POST, "/api/auth/refresh"))
                .rule(publicRoute(POST, "/api/auth/bootstrap-admin"))
                .rule(authenticated(POST, "/api/auth/logout").permitRevokedSession())
                .rule(authenticated(POST, "/api/auth/logout-all"))
                .rule(authenticated(GET, "/api/auth/me").permitInactive())
                .rule(authenticated(PUT, "/api/auth/password").permitInactive())

                // Operations and docs
                .rule(publicRoute(GET, "/actuator/health"))
                .rule(publicRoute(GET, "/actuator/info"))
                .rule(publicRoute(GET, "/swagger-ui.html"))
                .rule(publicRoute(GET, "/swagger-ui/**"))
                .rule(publicRoute(GET, "/v3/api-docs/**"))

                // Platform administration
                .rule(route(null, "/api/admin/**", ADMIN))
                .rule(route(GET, "/api/admin/colleges/{collegeId}/details", PRINCIPAL).scopedBy("collegeId"))

                // College staff
                .rule(route(null, "/api/principal/**", PRINCIPAL))
                .rule(route(null, "/api/coordinator/**", COORDINATOR))
                .rule(route(GET, "/api/analytics/college/domain-trend/{collegeId}", PRINCIPAL, COORDINATOR)
                        .scopedBy("collegeId"))

                // Innovators and mentors
                .rule(route(POST, "/api/ideas/draft", USER))
                .rule(route(GET, "/api/ideas/**", USER, MENTOR, COORDINATOR, PRINCIPAL))
                .rule(route(GET, "/api/mentors/my-requests", MENTOR))

                // Notifications: dispatch is for internal callers only, not even admin
                .rule(route(POST, "/api/notifications/dispatch", SERVICE).excludeAdmin())
                .rule(authenticated(GET, "/api/notifications"))
                .build();

        log.info("Loaded {} access rules; unlisted routes are admin-only", table.rules().size());
        log.debug("Access rules: {}", table.rules().stream().map(AccessRule::routeId).toList());
        return table;
    }
}
