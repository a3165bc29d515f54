package com.example.authservice.security;

import com.example.authservice.entity.Role;
import com.example.authservice.exception.TokenException;
import com.example.authservice.exception.TokenException.Reason;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies access tokens.
 *
 * Algorithm: HS256 only. Tokens with any other "alg" header, including "none", are rejected.
 * Claims:
 * - sub: user ID
 * - role: Role name
 * - org: college scope (optional)
 * - sid: session family ID (optional)
 * - typ: "access"
 * - jti, iss, iat, nbf, exp
 *
 * The MAC comparison inside JJWT is constant-time (MessageDigest.isEqual).
 */
public class TokenCodec {

    private static final Logger log = LoggerFactory.getLogger(TokenCodec.class);

    static final String CLAIM_ROLE = "role";
    static final String CLAIM_ORGANIZATION = "org";
    static final String CLAIM_SESSION = "sid";
    static final String CLAIM_TOKEN_TYPE = "typ";
    static final String TOKEN_TYPE_ACCESS = "access";
    static final String ALGORITHM = "HS256";

    private final SecretKey secretKey;
    private final String issuer;
    private final Duration clockSkew;
    private final Clock clock;
    private final JwtParser parser;

    public TokenCodec(String secret, String issuer, Duration clockSkew, Clock clock) {
        byte[] secretBytes = JwtSecretValidator.validate(secret);
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalStateException("JWT issuer must not be blank");
        }
        if (clockSkew == null || clockSkew.isNegative()) {
            throw new IllegalStateException("Clock skew must be zero or positive");
        }
        this.secretKey = new SecretKeySpec(secretBytes, "HmacSHA256");
        this.issuer = issuer;
        this.clockSkew = clockSkew;
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(secretKey)
                .requireIssuer(issuer)
                .clockSkewSeconds(clockSkew.getSeconds())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Issue a signed access token valid from now until now + ttl.
     * Timestamps are truncated to seconds, the precision of JWT NumericDate.
     */
    public IssuedToken issue(TokenSubject subject, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.compareTo(Duration.ofSeconds(1)) < 0) {
            throw new IllegalArgumentException("ttl must be at least one second");
        }
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(ttl).truncatedTo(ChronoUnit.SECONDS);

        JwtBuilder builder = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .issuer(issuer)
                .subject(subject.subjectId())
                .claim(CLAIM_ROLE, subject.role().name())
                .claim(CLAIM_TOKEN_TYPE, TOKEN_TYPE_ACCESS)
                .issuedAt(Date.from(now))
                .notBefore(Date.from(now))
                .expiration(Date.from(expiresAt));
        if (subject.organizationId() != null) {
            builder.claim(CLAIM_ORGANIZATION, subject.organizationId());
        }
        if (subject.sessionId() != null) {
            builder.claim(CLAIM_SESSION, subject.sessionId());
        }
        String token = builder.signWith(secretKey, Jwts.SIG.HS256).compact();

        Identity identity = new Identity(subject.subjectId(), subject.role(), now, expiresAt,
                subject.organizationId(), subject.sessionId(), true);
        return new IssuedToken(token, identity);
    }

    /**
     * Verify signature, algorithm, issuer and time window (exp and nbf, each with clock skew),
     * then decode the identity.
     *
     * @throws TokenException MALFORMED, BAD_SIGNATURE, EXPIRED or NOT_YET_VALID
     */
    public Identity verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenException(Reason.MALFORMED, "empty token");
        }

        Jws<Claims> jws;
        try {
            jws = parser.parseSignedClaims(token);
        } catch (ExpiredJwtException e) {
            throw failure(Reason.EXPIRED, e);
        } catch (PrematureJwtException e) {
            throw failure(Reason.NOT_YET_VALID, e);
        } catch (io.jsonwebtoken.security.SecurityException | UnsupportedJwtException e) {
            // MAC mismatch, weak/foreign key algorithm, or unsecured ("none") token
            throw failure(Reason.BAD_SIGNATURE, e);
        } catch (JwtException | IllegalArgumentException e) {
            throw failure(Reason.MALFORMED, e);
        }

        if (!ALGORITHM.equals(jws.getHeader().getAlgorithm())) {
            throw new TokenException(Reason.BAD_SIGNATURE, "unexpected algorithm " + jws.getHeader().getAlgorithm());
        }

        return toIdentity(jws.getPayload());
    }

    private Identity toIdentity(Claims claims) {
        Instant now = clock.instant();
        try {
            if (!TOKEN_TYPE_ACCESS.equals(claims.get(CLAIM_TOKEN_TYPE, String.class))) {
                throw new TokenException(Reason.MALFORMED, "not an access token");
            }
            String subjectId = claims.getSubject();
            String roleName = claims.get(CLAIM_ROLE, String.class);
            Date issuedAt = claims.getIssuedAt();
            Date expiration = claims.getExpiration();
            if (subjectId == null || subjectId.isBlank() || roleName == null || issuedAt == null || expiration == null) {
                throw new TokenException(Reason.MALFORMED, "missing required claim");
            }

            // JJWT treats exp + skew as still valid; the boundary itself counts as expired
            if (!now.isBefore(expiration.toInstant().plus(clockSkew))) {
                throw new TokenException(Reason.EXPIRED, "expired at " + expiration.toInstant());
            }

            return new Identity(
                    subjectId,
                    Role.valueOf(roleName),
                    issuedAt.toInstant(),
                    expiration.toInstant(),
                    claims.get(CLAIM_ORGANIZATION, String.class),
                    claims.get(CLAIM_SESSION, String.class),
                    true
            );
        } catch (JwtException | IllegalArgumentException e) {
            // RequiredTypeException, unknown role, exp <= iat
            throw failure(Reason.MALFORMED, e);
        }
    }

    private TokenException failure(Reason reason, Exception cause) {
        log.debug("JWT validation failed: {} ({})", reason, cause.getClass().getSimpleName());
        return new TokenException(reason, cause.getClass().getSimpleName(), cause);
    }
}
