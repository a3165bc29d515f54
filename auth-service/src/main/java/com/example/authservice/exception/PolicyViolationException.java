package com.example.authservice.exception;

import com.example.authservice.security.DenyReason;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Authenticated caller is not allowed on the route (HTTP 403).
 */
@Getter
public class PolicyViolationException extends BaseException {

    private final DenyReason reason;

    public PolicyViolationException(DenyReason reason, String routeId) {
        super("FORBIDDEN", "Access denied", HttpStatus.FORBIDDEN, reason + " on " + routeId);
        this.reason = reason;
    }
}
