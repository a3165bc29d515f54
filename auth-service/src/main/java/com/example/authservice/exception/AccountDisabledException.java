package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Correct credentials for a disabled account (HTTP 403).
 * Only raised after the password matched.
 */
public class AccountDisabledException extends BaseException {

    public AccountDisabledException(String subjectId) {
        super("ACCOUNT_DISABLED", "Account is disabled. Please contact administrator.",
                HttpStatus.FORBIDDEN, "disabled account " + subjectId);
    }
}
