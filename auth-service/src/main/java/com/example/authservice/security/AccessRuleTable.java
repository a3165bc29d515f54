package com.example.authservice.security;

import com.example.authservice.entity.Role;
import org.springframework.http.HttpMethod;
import org.springframework.http.server.PathContainer;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup table from (method, path) to the governing {@link AccessRule}.
 *
 * The most specific matching pattern wins; for equally specific patterns a rule bound to
 * the request method beats a method-agnostic one. A request no rule covers falls back to
 * {@link #DEFAULT_DENY}, which only ADMIN passes.
 */
public final class AccessRuleTable {

    /**
     * Rule for unregistered routes: no permitted roles, admin override only.
     */
    public static final AccessRule DEFAULT_DENY =
            new AccessRule(null, "/**", Set.of(), false, false, false, false, null);

    private static final Comparator<Entry> PRECEDENCE = Comparator
            .comparing(Entry::pattern, PathPattern.SPECIFICITY_COMPARATOR)
            .thenComparing(entry -> entry.rule().method() == null);

    private final List<Entry> entries;

    private AccessRuleTable(List<Entry> entries) {
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(PRECEDENCE);
        this.entries = List.copyOf(sorted);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Find the rule governing a request.
     *
     * HEAD is matched as GET, the same way Spring MVC serves it.
     *
     * @param method HTTP method of the request
     * @param path   request path without context path
     */
    public RouteMatch match(HttpMethod method, String path) {
        HttpMethod effective = HttpMethod.HEAD.equals(method) ? HttpMethod.GET : method;
        PathContainer container = PathContainer.parsePath(path);
        for (Entry entry : entries) {
            if (entry.rule().method() != null && !entry.rule().method().equals(effective)) {
                continue;
            }
            PathPattern.PathMatchInfo info = entry.pattern().matchAndExtract(container);
            if (info != null) {
                return new RouteMatch(entry.rule(), info.getUriVariables());
            }
        }
        return new RouteMatch(DEFAULT_DENY, Map.of());
    }

    public List<AccessRule> rules() {
        return entries.stream().map(Entry::rule).toList();
    }

    /**
     * Matched rule plus the path variables captured by its pattern.
     */
    public record RouteMatch(AccessRule rule, Map<String, String> pathVariables) {

        public RouteMatch {
            pathVariables = Map.copyOf(pathVariables);
        }

        public boolean isDefaultDeny() {
            return rule == DEFAULT_DENY;
        }
    }

    private record Entry(AccessRule rule, PathPattern pattern) {
    }

    /**
     * Collects rules and validates them as a set.
     */
    public static final class Builder {

        private final PathPatternParser parser = new PathPatternParser();
        private final List<Entry> entries = new ArrayList<>();
        private final Set<String> routeIds = new HashSet<>();

        private Builder() {
        }

        public Builder rule(AccessRule rule) {
            validate(rule);
            if (!routeIds.add(rule.routeId())) {
                throw new IllegalStateException("Duplicate access rule for " + rule.routeId());
            }
            PathPattern pattern;
            try {
                pattern = parser.parse(rule.pattern());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid route pattern in " + rule.routeId(), e);
            }
            entries.add(new Entry(rule, pattern));
            return this;
        }

        public AccessRuleTable build() {
            return new AccessRuleTable(entries);
        }

        private static void validate(AccessRule rule) {
            if (rule.adminExcluded() && rule.permittedRoles().contains(Role.ADMIN)) {
                throw new IllegalStateException(
                        "Rule " + rule.routeId() + " both permits ADMIN and excludes admin override");
            }
            if (rule.publicRoute()) {
                if (rule.scopeVariable() != null) {
                    throw new IllegalStateException("Public rule " + rule.routeId() + " cannot be scoped");
                }
                return;
            }
            if (rule.permittedRoles().isEmpty()) {
                throw new IllegalStateException("Rule " + rule.routeId() + " permits no role");
            }
            if (rule.scopeVariable() != null && !rule.pattern().contains("{" + rule.scopeVariable() + "}")) {
                throw new IllegalStateException(
                        "Rule " + rule.routeId() + " is scoped by unknown path variable " + rule.scopeVariable());
            }
        }
    }
}
