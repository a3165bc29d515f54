package com.example.authservice.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Startup checks for the JWT signing secret.
 *
 * Throws IllegalStateException, which aborts context startup:
 * 1. Secret is null or blank
 * 2. Secret is shorter than 256 bits (HS256 key size)
 * 3. Secret is a known placeholder value
 */
public final class JwtSecretValidator {

    private static final Logger log = LoggerFactory.getLogger(JwtSecretValidator.class);

    static final int MINIMUM_KEY_LENGTH = 32;     // 256 bits
    static final int RECOMMENDED_KEY_LENGTH = 64; // 512 bits

    private static final Set<String> INSECURE_DEFAULTS = Set.of(
            "secret",
            "your-256-bit-secret",
            "your-256-bit-secret-key-change-this-in-production",
            "change-this-in-production",
            "default-secret-key",
            "change-me-change-me-change-me-change-me"
    );

    private JwtSecretValidator() {
    }

    public static byte[] validate(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException(
                    "JWT secret is not configured! Set environment variable JWT_SECRET or property auth.jwt.secret");
        }

        if (INSECURE_DEFAULTS.contains(secret)) {
            throw new IllegalStateException(
                    "JWT secret is a known placeholder value. Generate a strong secret: openssl rand -base64 48");
        }

        byte[] secretBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MINIMUM_KEY_LENGTH) {
            throw new IllegalStateException(String.format(
                    "JWT secret must be at least %d bytes (256 bits). Current secret is %d bytes.",
                    MINIMUM_KEY_LENGTH, secretBytes.length));
        }

        if (secretBytes.length < RECOMMENDED_KEY_LENGTH) {
            log.warn("JWT secret length is {} bytes. Consider using at least {} bytes.",
                    secretBytes.length, RECOMMENDED_KEY_LENGTH);
        }
        if (secret.matches("^[a-z0-9]+$")) {
            log.warn("JWT secret only contains lowercase letters and digits. Consider a random secret.");
        }
        return secretBytes;
    }
}
