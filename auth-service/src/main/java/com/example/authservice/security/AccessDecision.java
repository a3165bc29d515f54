package com.example.authservice.security;

/**
 * Outcome of an access check. reason is null when allowed.
 */
public record AccessDecision(boolean allowed, DenyReason reason) {

    private static final AccessDecision ALLOW = new AccessDecision(true, null);

    public AccessDecision {
        if (allowed == (reason != null)) {
            throw new IllegalArgumentException("An allowed decision has no reason; a denial needs one");
        }
    }

    public static AccessDecision allow() {
        return ALLOW;
    }

    public static AccessDecision deny(DenyReason reason) {
        return new AccessDecision(false, reason);
    }
}
