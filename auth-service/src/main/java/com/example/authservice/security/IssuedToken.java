package com.example.authservice.security;

/**
 * Compact JWS plus the identity it encodes.
 */
public record IssuedToken(String value, Identity identity) {
}
