package com.example.authservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Refresh token rejected (HTTP 401).
 */
@Getter
public class RefreshException extends BaseException {

    public enum Reason {
        UNKNOWN_TOKEN,
        REVOKED,
        EXPIRED,
        REUSE_DETECTED
    }

    private final Reason reason;

    public RefreshException(Reason reason, String detail) {
        super("UNAUTHORIZED", "Invalid refresh token", HttpStatus.UNAUTHORIZED, reason + ": " + detail);
        this.reason = reason;
    }
}
