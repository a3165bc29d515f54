package com.example.authservice.service;

import com.example.authservice.dto.BootstrapAdminRequest;
import com.example.authservice.dto.ChangePasswordRequest;
import com.example.authservice.dto.LoginRequest;
import com.example.authservice.dto.TokenPairResponse;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.SessionFamily.RevokeReason;
import com.example.authservice.entity.User;
import com.example.authservice.exception.AccountDisabledException;
import com.example.authservice.exception.ConflictException;
import com.example.authservice.exception.InvalidCredentialsException;
import com.example.authservice.repository.UserRepository;
import com.example.authservice.security.Identity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

/**
 * Authentication service: credential checks and account-level operations.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final SessionService sessionService;
    private final AuditService auditService;

    // Compared against when the email is unknown so both failure paths cost one BCrypt check
    private final String dummyPasswordHash;

    public AuthService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            SessionService sessionService,
            AuditService auditService) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.sessionService = sessionService;
        this.auditService = auditService;
        this.dummyPasswordHash = passwordEncoder.encode("timing-equalizer-not-a-password");
    }

    /**
     * UC-LOGIN: Authenticate user and return tokens.
     *
     * CRITICAL SECURITY: Password validation BEFORE status check (anti-enumeration).
     *
     * Accounts that are not yet activated may log in; the access policy limits them to
     * routes that allow inactive accounts.
     *
     * @throws InvalidCredentialsException if email not found or password incorrect (401)
     * @throws AccountDisabledException if account is disabled (403)
     */
    @Transactional
    public TokenPairResponse login(LoginRequest request) {
        String email = normalizeEmail(request.email());
        Optional<User> found = userRepository.findByEmail(email);

        if (found.isEmpty()) {
            passwordEncoder.matches(request.password(), dummyPasswordHash);
            auditService.logLoginFailure(null, email, "User not found");
            throw new InvalidCredentialsException("unknown email");
        }
        User user = found.get();

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            auditService.logLoginFailure(user.getId(), email, "Invalid password");
            throw new InvalidCredentialsException("wrong password for " + user.getId());
        }

        if (user.isDisabled()) {
            auditService.logLoginDenied(user, "Account is disabled");
            throw new AccountDisabledException(user.getId());
        }

        TokenPairResponse tokens = sessionService.openSession(user);
        auditService.logLoginSuccess(user);
        log.debug("User {} logged in with role {}", user.getId(), user.getRole());
        return tokens;
    }

    /**
     * Create the first platform administrator and log them in.
     *
     * @throws ConflictException once any ADMIN account exists, or if the email is taken (409)
     */
    @Transactional
    public TokenPairResponse bootstrapAdmin(BootstrapAdminRequest request) {
        if (userRepository.existsByRole(Role.ADMIN)) {
            throw new ConflictException("An administrator already exists");
        }
        String email = normalizeEmail(request.email());
        if (userRepository.existsByEmail(email)) {
            throw new ConflictException("Email already registered");
        }

        User admin = new User();
        admin.setEmail(email);
        admin.setPasswordHash(passwordEncoder.encode(request.password()));
        admin.setFullName(request.fullName().trim());
        admin.setRole(Role.ADMIN);
        admin.setStatus(User.Status.ACTIVE);

        // DB UNIQUE constraint handles a concurrent registration of the same email
        try {
            admin = userRepository.saveAndFlush(admin);
        } catch (DataIntegrityViolationException ex) {
            throw new ConflictException("Email already registered");
        }

        log.info("Bootstrap administrator {} created", admin.getId());
        auditService.logAdminBootstrap(admin);
        return sessionService.openSession(admin);
    }

    /**
     * Change the caller's password. Revokes every session of the account, and activates an
     * account that was still pending.
     *
     * @throws InvalidCredentialsException if the current password does not match (401)
     */
    @Transactional
    public void changePassword(Identity identity, ChangePasswordRequest request) {
        User user = userRepository.findById(identity.subjectId())
                .orElseThrow(() -> new InvalidCredentialsException("user " + identity.subjectId() + " not found"));

        if (!passwordEncoder.matches(request.currentPassword(), user.getPasswordHash())) {
            auditService.logLoginFailure(user.getId(), user.getEmail(), "Invalid current password on password change");
            throw new InvalidCredentialsException("wrong current password for " + user.getId());
        }

        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        if (user.getStatus() == User.Status.PENDING) {
            user.setStatus(User.Status.ACTIVE);
        }
        userRepository.save(user);

        int revoked = sessionService.revokeAllForSubject(user.getId(), RevokeReason.PASSWORD_CHANGE);
        auditService.logPasswordChange(user, revoked);
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
