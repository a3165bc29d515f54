package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Login rejected: unknown email or wrong password (HTTP 401).
 * Both cases share one message to avoid account enumeration.
 */
public class InvalidCredentialsException extends BaseException {

    public InvalidCredentialsException(String detail) {
        super("UNAUTHORIZED", "Invalid credentials", HttpStatus.UNAUTHORIZED, detail);
    }
}
