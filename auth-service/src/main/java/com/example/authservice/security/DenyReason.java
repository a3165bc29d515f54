package com.example.authservice.security;

/**
 * Why an authenticated caller was refused on a route.
 */
public enum DenyReason {
    INSUFFICIENT_ROLE,
    SCOPE_MISMATCH,
    DISABLED
}
