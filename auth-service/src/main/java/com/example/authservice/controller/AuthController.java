package com.example.authservice.controller;

import com.example.authservice.dto.BootstrapAdminRequest;
import com.example.authservice.dto.ChangePasswordRequest;
import com.example.authservice.dto.IdentityResponse;
import com.example.authservice.dto.LoginRequest;
import com.example.authservice.dto.RefreshTokenRequest;
import com.example.authservice.dto.TokenPairResponse;
import com.example.authservice.security.CurrentIdentity;
import com.example.authservice.service.AuthService;
import com.example.authservice.service.SessionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Authentication controller.
 *
 * Access to each endpoint is decided by JwtAuthenticationFilter from the route table;
 * handlers that need the caller read it from {@link CurrentIdentity}.
 */
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;
    private final SessionService sessionService;
    private final CurrentIdentity currentIdentity;

    public AuthController(
            AuthService authService,
            SessionService sessionService,
            CurrentIdentity currentIdentity) {
        this.authService = authService;
        this.sessionService = sessionService;
        this.currentIdentity = currentIdentity;
    }

    /**
     * POST /api/auth/login
     *
     * @return 200 OK with token pair
     * @throws com.example.authservice.exception.InvalidCredentialsException 401
     * @throws com.example.authservice.exception.AccountDisabledException 403
     */
    @PostMapping("/login")
    public ResponseEntity<TokenPairResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    /**
     * POST /api/auth/refresh
     *
     * @return 200 OK with a new token pair; the presented refresh token is consumed
     * @throws com.example.authservice.exception.RefreshException 401
     */
    @PostMapping("/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(sessionService.refresh(request.refreshToken()));
    }

    /**
     * POST /api/auth/logout
     *
     * Revokes the session the access token belongs to. Idempotent.
     *
     * @return 204 No Content
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout() {
        sessionService.logout(currentIdentity.require());
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/auth/logout-all
     *
     * @return 204 No Content
     */
    @PostMapping("/logout-all")
    public ResponseEntity<Void> logoutAll() {
        sessionService.logoutAll(currentIdentity.require());
        return ResponseEntity.noContent().build();
    }

    /**
     * GET /api/auth/me
     *
     * @return 200 OK with the caller's resolved identity
     */
    @GetMapping("/me")
    public ResponseEntity<IdentityResponse> me() {
        return ResponseEntity.ok(IdentityResponse.from(currentIdentity.require()));
    }

    /**
     * PUT /api/auth/password
     *
     * @return 204 No Content; every session of the account is revoked
     */
    @PutMapping("/password")
    public ResponseEntity<Void> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        authService.changePassword(currentIdentity.require(), request);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /api/auth/bootstrap-admin
     *
     * @return 201 Created with token pair while no administrator exists
     * @throws com.example.authservice.exception.ConflictException 409 afterwards
     */
    @PostMapping("/bootstrap-admin")
    public ResponseEntity<TokenPairResponse> bootstrapAdmin(@Valid @RequestBody BootstrapAdminRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.bootstrapAdmin(request));
    }
}
