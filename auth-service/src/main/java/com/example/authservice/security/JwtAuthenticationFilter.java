package com.example.authservice.security;

import com.example.authservice.exception.BaseException;
import com.example.authservice.exception.PolicyViolationException;
import com.example.authservice.exception.TokenException;
import com.example.authservice.exception.TokenException.Reason;
import com.example.authservice.security.AccessRuleTable.RouteMatch;
import com.example.authservice.service.AuditService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.lang.NonNull;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;

/**
 * Single authentication and authorization gate for every request.
 *
 * Flow:
 * HTTP Request → extract bearer → TokenCodec.verify → IdentityResolver.resolve
 *   → AccessPolicy.enforce → IdentityAuthentication in SecurityContext → Controller
 *
 * Any failure ends the request with one JSON error body (401 / 403 / 503). The caller only
 * sees the coarse message; the stage and internal reason are logged.
 *
 * Public routes pass through. A valid bearer token on a public route is still attached;
 * an invalid one is ignored.
 */
@Component
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String IDENTITY_ATTRIBUTE = Identity.class.getName();
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_ROLE = "role";

    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Last stage a request reached. A rejection is reported with the stage it failed after.
     */
    enum Stage {
        NO_TOKEN,
        EXTRACTED,
        VERIFIED,
        RESOLVED,
        AUTHORIZED,
        ATTACHED
    }

    private final TokenCodec tokenCodec;
    private final IdentityResolver identityResolver;
    private final AccessPolicy accessPolicy;
    private final ErrorResponseWriter errorResponseWriter;
    private final AuditService auditService;
    private final UrlPathHelper urlPathHelper = new UrlPathHelper();

    public JwtAuthenticationFilter(
            TokenCodec tokenCodec,
            IdentityResolver identityResolver,
            AccessPolicy accessPolicy,
            ErrorResponseWriter errorResponseWriter,
            AuditService auditService) {
        this.tokenCodec = tokenCodec;
        this.identityResolver = identityResolver;
        this.accessPolicy = accessPolicy;
        this.errorResponseWriter = errorResponseWriter;
        this.auditService = auditService;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        RouteMatch match = routeOf(request);

        Identity identity;
        if (match.rule().publicRoute()) {
            identity = authenticateOptional(request);
        } else {
            Stage stage = Stage.NO_TOKEN;
            Identity resolved = null;
            try {
                String token = extractToken(request);
                stage = Stage.EXTRACTED;

                Identity claimed = tokenCodec.verify(token);
                stage = Stage.VERIFIED;

                resolved = identityResolver.resolve(claimed, match.rule().allowRevokedSession());
                stage = Stage.RESOLVED;

                accessPolicy.enforce(resolved, match);
                stage = Stage.AUTHORIZED;
                identity = resolved;
            } catch (BaseException ex) {
                reject(request, response, match, stage, resolved, ex);
                return;
            }
        }

        if (identity == null) {
            filterChain.doFilter(request, response);
            return;
        }

        attach(request, identity);
        MDC.put(MDC_USER_ID, identity.subjectId());
        MDC.put(MDC_ROLE, identity.role().name());
        try {
            log.debug("Request authenticated at stage {}: subject={} route={}",
                    Stage.ATTACHED, identity.subjectId(), match.rule().routeId());
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_USER_ID);
            MDC.remove(MDC_ROLE);
        }
    }

    /**
     * Rule that governs this request.
     */
    public RouteMatch routeOf(HttpServletRequest request) {
        String path = urlPathHelper.getPathWithinApplication(request);
        return accessPolicy.route(HttpMethod.valueOf(request.getMethod()), path);
    }

    /**
     * Read the bearer token. Only the Authorization header is consulted; the scheme is
     * case-insensitive.
     *
     * @throws TokenException MISSING without header, MALFORMED for other schemes or an empty value
     */
    static String extractToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null) {
            throw new TokenException(Reason.MISSING, "no Authorization header");
        }
        if (header.length() < BEARER_PREFIX.length()
                || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new TokenException(Reason.MALFORMED, "unsupported authorization scheme");
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new TokenException(Reason.MALFORMED, "empty bearer token");
        }
        return token;
    }

    private Identity authenticateOptional(HttpServletRequest request) {
        if (request.getHeader(HttpHeaders.AUTHORIZATION) == null) {
            return null;
        }
        try {
            return identityResolver.resolve(tokenCodec.verify(extractToken(request)));
        } catch (BaseException ex) {
            log.debug("Ignoring invalid credentials on public route {}: {}",
                    request.getRequestURI(), ex.getDetail());
            return null;
        }
    }

    private void attach(HttpServletRequest request, Identity identity) {
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(new IdentityAuthentication(identity));
        SecurityContextHolder.setContext(context);
        request.setAttribute(IDENTITY_ATTRIBUTE, identity);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, RouteMatch match,
                        Stage stage, Identity resolved, BaseException ex) throws IOException {
        log.warn("Request rejected after stage {}: {} {} route={} unregistered={} status={} reason={}",
                stage, request.getMethod(), request.getRequestURI(), match.rule().routeId(),
                match.isDefaultDeny(), ex.getStatus().value(), ex.getDetail());

        if (ex instanceof PolicyViolationException violation) {
            auditService.logAccessDenied(resolved != null ? resolved.subjectId() : null,
                    match.rule().routeId(), violation.getReason());
        }

        SecurityContextHolder.clearContext();
        errorResponseWriter.write(response, ex);
    }
}
