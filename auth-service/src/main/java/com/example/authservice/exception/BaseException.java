package com.example.authservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception class for all auth exceptions.
 *
 * message is what the caller sees; detail is the internal reason and only goes to logs.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final String code;
    private final HttpStatus status;
    private final String detail;

    protected BaseException(String code, String message, HttpStatus status, String detail) {
        super(message);
        this.code = code;
        this.status = status;
        this.detail = detail;
    }

    protected BaseException(String code, String message, HttpStatus status, String detail, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
        this.detail = detail;
    }
}
