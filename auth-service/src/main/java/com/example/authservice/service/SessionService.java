package com.example.authservice.service;

import com.example.authservice.config.AuthProperties;
import com.example.authservice.config.AuthProperties.SessionPolicy;
import com.example.authservice.dto.TokenPairResponse;
import com.example.authservice.entity.RefreshToken;
import com.example.authservice.entity.SessionFamily;
import com.example.authservice.entity.SessionFamily.RevokeReason;
import com.example.authservice.entity.User;
import com.example.authservice.exception.AccountDisabledException;
import com.example.authservice.exception.RefreshException;
import com.example.authservice.exception.RefreshException.Reason;
import com.example.authservice.repository.UserRepository;
import com.example.authservice.security.Identity;
import com.example.authservice.security.IssuedToken;
import com.example.authservice.security.SessionStore;
import com.example.authservice.security.TokenCodec;
import com.example.authservice.security.TokenSubject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Session lifecycle: token pair issuance, refresh-token rotation with reuse detection, logout.
 *
 * Refresh Token Format: 32 random bytes, base64url (opaque, NOT a JWT). Only its SHA-256 hash
 * is stored.
 *
 * Every successful refresh consumes the presented token and issues a new one in the same
 * session family. Presenting a consumed token again, or losing the rotation compare-and-set to
 * a concurrent request, revokes the whole family; access tokens carrying the family id then
 * fail identity resolution.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private static final int REFRESH_TOKEN_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SessionStore sessionStore;
    private final UserRepository userRepository;
    private final TokenCodec tokenCodec;
    private final AuditService auditService;
    private final AuthProperties properties;
    private final Clock clock;

    public SessionService(
            SessionStore sessionStore,
            UserRepository userRepository,
            TokenCodec tokenCodec,
            AuditService auditService,
            AuthProperties properties,
            Clock clock) {
        this.sessionStore = sessionStore;
        this.userRepository = userRepository;
        this.tokenCodec = tokenCodec;
        this.auditService = auditService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Start a new session family for an authenticated user and issue its first token pair.
     * Under the SINGLE session policy the user's other families are revoked.
     */
    @Transactional
    public TokenPairResponse openSession(User user) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(refreshTtl());
        String familyId = UUID.randomUUID().toString();

        String refreshToken = newOpaqueToken();
        RefreshToken first = new RefreshToken(UUID.randomUUID().toString(), familyId, hash(refreshToken), now, expiresAt);
        sessionStore.createFamily(user.getId(), first, expiresAt);

        if (properties.getSession().getPolicy() == SessionPolicy.SINGLE) {
            int revoked = sessionStore.revokeOtherFamilies(user.getId(), familyId, RevokeReason.SINGLE_SESSION);
            if (revoked > 0) {
                log.info("Single-session policy: revoked {} previous sessions of user {}", revoked, user.getId());
            }
        }

        return issuePair(user, familyId, refreshToken);
    }

    /**
     * UC-REFRESH-TOKEN: Rotate refresh token and issue new access token.
     *
     * Steps:
     * 1. Find token by hash (UNKNOWN_TOKEN)
     * 2. Family revoked (REVOKED)
     * 3. Token already consumed or no longer current: REUSE, revoke family
     * 4. Token or family expired (EXPIRED)
     * 5. Account status checked BEFORE generating new tokens
     * 6. Compare-and-set rotation; losing the race counts as reuse
     * 7. Issue new pair with the user's current role and scope
     *
     * Revocations in steps 3, 5 and 6 must commit even though the call fails.
     */
    @Transactional(noRollbackFor = {RefreshException.class, AccountDisabledException.class})
    public TokenPairResponse refresh(String refreshToken) {
        Instant now = clock.instant();

        // Step 1
        RefreshToken presented = sessionStore.findTokenByHash(hash(refreshToken))
                .orElseThrow(() -> new RefreshException(Reason.UNKNOWN_TOKEN, "no matching token"));

        // Step 2
        SessionFamily family = sessionStore.findFamily(presented.getFamilyId())
                .orElseThrow(() -> new RefreshException(Reason.REVOKED, "session " + presented.getFamilyId() + " gone"));
        if (family.isRevoked()) {
            throw new RefreshException(Reason.REVOKED, "session " + family.getId() + " revoked: " + family.getRevokeReason());
        }

        // Step 3
        if (presented.isConsumed() || !presented.getId().equals(family.getCurrentTokenId())) {
            throw reuseDetected(family);
        }

        // Step 4
        if (presented.isExpiredAt(now) || !now.isBefore(family.getExpiresAt())) {
            auditService.logRefreshExpired(family.getSubjectId());
            throw new RefreshException(Reason.EXPIRED, "session " + family.getId() + " expired");
        }

        // Step 5
        User user = userRepository.findById(family.getSubjectId()).orElse(null);
        if (user == null || user.isDisabled()) {
            log.warn("SECURITY: Disabled or deleted user {} tried to refresh. Revoking all sessions.",
                    family.getSubjectId());
            sessionStore.revokeAllForSubject(family.getSubjectId(), RevokeReason.ACCOUNT_DISABLED);
            if (user != null) {
                auditService.logLoginDenied(user, "Account is disabled");
            }
            throw new AccountDisabledException(family.getSubjectId());
        }

        // Step 6
        String nextToken = newOpaqueToken();
        Instant nextExpiry = now.plus(refreshTtl());
        RefreshToken next = new RefreshToken(UUID.randomUUID().toString(), family.getId(), hash(nextToken), now, nextExpiry);
        if (!sessionStore.rotate(family.getId(), presented, next, nextExpiry)) {
            throw reuseDetected(family);
        }

        // Step 7
        auditService.logRefreshSuccess(user.getId());
        return issuePair(user, family.getId(), nextToken);
    }

    /**
     * UC-LOGOUT: revoke the caller's session family. Idempotent: an already revoked or
     * session-less identity is a no-op.
     */
    @Transactional
    public void logout(Identity identity) {
        if (identity.sessionId() == null) {
            return;
        }
        if (sessionStore.revokeFamily(identity.sessionId(), RevokeReason.LOGOUT)) {
            auditService.logLogout(identity.subjectId(), identity.sessionId());
        }
    }

    /**
     * Revoke every session of the caller, including the current one.
     */
    @Transactional
    public int logoutAll(Identity identity) {
        int revoked = sessionStore.revokeAllForSubject(identity.subjectId(), RevokeReason.LOGOUT_ALL);
        auditService.logLogoutAll(identity.subjectId(), revoked);
        return revoked;
    }

    @Transactional
    public int revokeAllForSubject(String subjectId, RevokeReason reason) {
        int revoked = sessionStore.revokeAllForSubject(subjectId, reason);
        if (revoked > 0) {
            log.info("Revoked {} sessions of user {} ({})", revoked, subjectId, reason);
        }
        return revoked;
    }

    public long accessTokenTtlSeconds() {
        return properties.getJwt().getAccessTokenTtl().toSeconds();
    }

    private TokenPairResponse issuePair(User user, String familyId, String refreshToken) {
        TokenSubject subject = new TokenSubject(user.getId(), user.getRole(), user.getOrganizationId(), familyId);
        IssuedToken accessToken = tokenCodec.issue(subject, properties.getJwt().getAccessTokenTtl());
        return TokenPairResponse.of(accessToken.value(), refreshToken, accessTokenTtlSeconds());
    }

    private RefreshException reuseDetected(SessionFamily family) {
        sessionStore.revokeFamily(family.getId(), RevokeReason.REUSE_DETECTED);
        log.warn("SECURITY: Refresh token reuse detected for user {}. Session {} revoked.",
                family.getSubjectId(), family.getId());
        auditService.logRefreshReuse(family.getSubjectId(), family.getId());
        return new RefreshException(Reason.REUSE_DETECTED, "session " + family.getId());
    }

    private Duration refreshTtl() {
        return properties.getJwt().getRefreshTokenTtl();
    }

    private static String newOpaqueToken() {
        byte[] bytes = new byte[REFRESH_TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    static String hash(String refreshToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(refreshToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
