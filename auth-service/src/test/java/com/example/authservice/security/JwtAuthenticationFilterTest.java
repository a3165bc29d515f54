package com.example.authservice.security;

import com.example.authservice.config.AccessRulesConfig;
import com.example.authservice.entity.Role;
import com.example.authservice.exception.ResolverException;
import com.example.authservice.exception.TokenException;
import com.example.authservice.exception.TokenException.Reason;
import com.example.authservice.service.AuditService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Filter behaviour per stage, with a real codec and rule table and a mocked resolver.
 */
class JwtAuthenticationFilterTest {

    private static final String SECRET = "Fq8Lm2Xv-Rt5Wn9Kc-Hy3Pd7Jb-Ua6Es0Gz-Vo4Ni1Qx-Tk8Mw5Ry";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private TokenCodec tokenCodec;
    private IdentityResolver identityResolver;
    private AuditService auditService;
    private JwtAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        tokenCodec = new TokenCodec(SECRET, "pragati-auth-test", Duration.ofSeconds(30), Clock.fixed(NOW, ZoneOffset.UTC));
        identityResolver = mock(IdentityResolver.class);
        auditService = mock(AuditService.class);
        AccessPolicy accessPolicy = new AccessPolicy(new AccessRulesConfig().accessRuleTable());
        ErrorResponseWriter writer = new ErrorResponseWriter(new ObjectMapper().findAndRegisterModules());
        filter = new JwtAuthenticationFilter(tokenCodec, identityResolver, accessPolicy, writer, auditService);

        when(identityResolver.resolve(any(Identity.class), anyBoolean())).thenAnswer(inv -> inv.getArgument(0));
        when(identityResolver.resolve(any(Identity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
        MDC.clear();
    }

    private String tokenFor(Role role, String organizationId) {
        return tokenCodec.issue(new TokenSubject("user-1", role, organizationId, "family-1"), Duration.ofMinutes(15)).value();
    }

    private static MockHttpServletRequest request(String method, String path, String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, path);
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        return request;
    }

    // ==================== extractToken ====================

    @Test
    void extractsBearerTokenCaseInsensitively() {
        assertEquals("abc.def.ghi", JwtAuthenticationFilter.extractToken(request("GET", "/x", "Bearer abc.def.ghi")));
        assertEquals("abc.def.ghi", JwtAuthenticationFilter.extractToken(request("GET", "/x", "bearer abc.def.ghi")));
    }

    @Test
    void missingHeaderIsMissing() {
        TokenException ex = assertThrows(TokenException.class,
                () -> JwtAuthenticationFilter.extractToken(request("GET", "/x", null)));
        assertEquals(Reason.MISSING, ex.getReason());
    }

    @Test
    void otherSchemesAndEmptyValuesAreMalformed() {
        for (String header : new String[]{"Basic dXNlcjpwYXNz", "Bearer", "Bearer    ", "Token abc", ""}) {
            TokenException ex = assertThrows(TokenException.class,
                    () -> JwtAuthenticationFilter.extractToken(request("GET", "/x", header)), header);
            assertEquals(Reason.MALFORMED, ex.getReason(), header);
        }
    }

    // ==================== doFilter ====================

    @Test
    void protectedRouteWithoutTokenIsUnauthorized() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<Boolean> reached = new AtomicReference<>(false);

        filter.doFilter(request("GET", "/api/notifications", null), response, (req, res) -> reached.set(true));

        assertFalse(reached.get());
        assertEquals(401, response.getStatus());
        assertTrue(response.getContentAsString().contains("\"message\":\"Invalid credentials\""));
        assertFalse(response.getContentAsString().contains("MISSING"));
        verifyNoInteractions(identityResolver);
    }

    @Test
    void validTokenReachesHandlerWithIdentityAttached() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<Authentication> seen = new AtomicReference<>();
        AtomicReference<String> mdcUser = new AtomicReference<>();

        filter.doFilter(request("GET", "/api/mentors/my-requests", "Bearer " + tokenFor(Role.MENTOR, null)), response,
                (req, res) -> {
                    seen.set(SecurityContextHolder.getContext().getAuthentication());
                    mdcUser.set(MDC.get(JwtAuthenticationFilter.MDC_USER_ID));
                    assertNotNull(req.getAttribute(JwtAuthenticationFilter.IDENTITY_ATTRIBUTE));
                });

        assertEquals(200, response.getStatus());
        IdentityAuthentication authentication = assertInstanceOf(IdentityAuthentication.class, seen.get());
        assertEquals("user-1", authentication.getName());
        assertEquals(Role.MENTOR, authentication.getIdentity().role());
        assertEquals("user-1", mdcUser.get());
        assertNull(MDC.get(JwtAuthenticationFilter.MDC_USER_ID));
    }

    @Test
    void wrongRoleIsForbiddenAndAudited() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<Boolean> reached = new AtomicReference<>(false);

        filter.doFilter(request("GET", "/api/coordinator/stats", "Bearer " + tokenFor(Role.MENTOR, null)), response,
                (req, res) -> reached.set(true));

        assertFalse(reached.get());
        assertEquals(403, response.getStatus());
        assertTrue(response.getContentAsString().contains("\"message\":\"Access denied\""));
        verify(auditService).logAccessDenied("user-1", "* /api/coordinator/**", DenyReason.INSUFFICIENT_ROLE);
        assertNull(SecurityContextHolder.getContext().getAuthentication());
    }

    @Test
    void transientResolverFailureIsServiceUnavailable() throws Exception {
        when(identityResolver.resolve(any(Identity.class), anyBoolean()))
                .thenThrow(new ResolverException(ResolverException.Reason.TRANSIENT, "timeout"));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request("GET", "/api/notifications", "Bearer " + tokenFor(Role.USER, null)), response,
                (req, res) -> fail("handler must not run"));

        assertEquals(503, response.getStatus());
        assertEquals("1", response.getHeader("Retry-After"));
        verifyNoInteractions(auditService);
    }

    @Test
    void logoutRouteAcceptsRevokedSession() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request("POST", "/api/auth/logout", "Bearer " + tokenFor(Role.USER, null)), response,
                (req, res) -> { });

        verify(identityResolver).resolve(any(Identity.class), eq(true));
        assertEquals(200, response.getStatus());
    }

    @Test
    void publicRouteIgnoresInvalidToken() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<Boolean> reached = new AtomicReference<>(false);

        filter.doFilter(request("POST", "/api/auth/login", "Bearer garbage"), response, (req, res) -> {
            reached.set(true);
            assertNull(SecurityContextHolder.getContext().getAuthentication());
        });

        assertTrue(reached.get());
        assertEquals(200, response.getStatus());
    }

    @Test
    void unregisteredRouteIsAdminOnly() throws Exception {
        MockHttpServletResponse denied = new MockHttpServletResponse();
        filter.doFilter(request("DELETE", "/api/ideas/42", "Bearer " + tokenFor(Role.PRINCIPAL, "c-1")), denied,
                (req, res) -> fail("handler must not run"));
        assertEquals(403, denied.getStatus());

        MockHttpServletResponse allowed = new MockHttpServletResponse();
        filter.doFilter(request("DELETE", "/api/ideas/42", "Bearer " + tokenFor(Role.ADMIN, null)), allowed,
                (req, res) -> { });
        assertEquals(200, allowed.getStatus());
    }
}
