package com.example.authservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Auth configuration bound from the "auth" prefix. Invalid values abort startup.
 *
 * <pre>
 * auth:
 *   jwt:
 *     secret: ${JWT_SECRET}
 *     issuer: pragati-auth
 *     access-token-ttl: 15m
 *     refresh-token-ttl: 7d
 *     clock-skew: 30s
 *   session:
 *     policy: MULTIPLE
 *     cleanup-cron: "0 0 3 * * *"
 * </pre>
 */
@Getter
@Validated
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    @Valid
    private final Jwt jwt = new Jwt();

    @Valid
    private final Session session = new Session();

    @AssertTrue(message = "auth.jwt.refresh-token-ttl must be longer than auth.jwt.access-token-ttl")
    public boolean isRefreshTtlLongerThanAccessTtl() {
        if (jwt.accessTokenTtl == null || jwt.refreshTokenTtl == null) {
            return true;
        }
        return jwt.refreshTokenTtl.compareTo(jwt.accessTokenTtl) > 0;
    }

    @Getter
    @Setter
    public static class Jwt {

        /**
         * HS256 signing key; at least 32 bytes once UTF-8 encoded.
         */
        @NotBlank
        private String secret;

        @NotBlank
        private String issuer = "pragati-auth";

        @NotNull
        @DurationMin(seconds = 1)
        private Duration accessTokenTtl = Duration.ofMinutes(15);

        @NotNull
        @DurationMin(seconds = 1)
        private Duration refreshTokenTtl = Duration.ofDays(7);

        /**
         * Leeway applied to exp and nbf.
         */
        @NotNull
        @DurationMin(seconds = 0)
        private Duration clockSkew = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Session {

        @NotNull
        private SessionPolicy policy = SessionPolicy.MULTIPLE;

        @NotBlank
        private String cleanupCron = "0 0 3 * * *";
    }

    public enum SessionPolicy {
        /**
         * Any number of concurrent sessions per user
         */
        MULTIPLE,

        /**
         * A new login revokes the user's other sessions
         */
        SINGLE
    }
}
