package com.example.authservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Access token could not be accepted (HTTP 401).
 */
@Getter
public class TokenException extends BaseException {

    public enum Reason {
        MISSING,
        MALFORMED,
        BAD_SIGNATURE,
        EXPIRED,
        NOT_YET_VALID
    }

    private final Reason reason;

    public TokenException(Reason reason, String detail) {
        super("UNAUTHORIZED", "Invalid credentials", HttpStatus.UNAUTHORIZED, reason + ": " + detail);
        this.reason = reason;
    }

    public TokenException(Reason reason, String detail, Throwable cause) {
        super("UNAUTHORIZED", "Invalid credentials", HttpStatus.UNAUTHORIZED, reason + ": " + detail, cause);
        this.reason = reason;
    }
}
