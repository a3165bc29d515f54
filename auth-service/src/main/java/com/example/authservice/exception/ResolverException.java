package com.example.authservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A verified token could not be bound to a current user record.
 *
 * TRANSIENT maps to 503 and is safe to retry; every other reason is a 401.
 */
@Getter
public class ResolverException extends BaseException {

    public enum Reason {
        USER_NOT_FOUND,
        USER_DISABLED,
        ROLE_MISMATCH,
        SESSION_REVOKED,
        TRANSIENT
    }

    private final Reason reason;

    public ResolverException(Reason reason, String detail) {
        this(reason, detail, null);
    }

    public ResolverException(Reason reason, String detail, Throwable cause) {
        super(codeFor(reason), messageFor(reason), statusFor(reason), reason + ": " + detail, cause);
        this.reason = reason;
    }

    private static String codeFor(Reason reason) {
        return reason == Reason.TRANSIENT ? "SERVICE_UNAVAILABLE" : "UNAUTHORIZED";
    }

    private static String messageFor(Reason reason) {
        return reason == Reason.TRANSIENT ? "Service temporarily unavailable" : "Invalid credentials";
    }

    private static HttpStatus statusFor(Reason reason) {
        return reason == Reason.TRANSIENT ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.UNAUTHORIZED;
    }
}
