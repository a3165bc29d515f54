package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when the requested state already exists (HTTP 409).
 */
public class ConflictException extends BaseException {

    public ConflictException(String message) {
        super("CONFLICT", message, HttpStatus.CONFLICT, message);
    }
}
