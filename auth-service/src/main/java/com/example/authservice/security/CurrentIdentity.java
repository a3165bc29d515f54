package com.example.authservice.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Helper to read the caller's identity from the SecurityContext.
 *
 * Returns Optional so anonymous requests on public routes are handled without exceptions.
 */
@Component
public class CurrentIdentity {

    public Optional<Identity> get() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication instanceof IdentityAuthentication identityAuthentication) {
            return Optional.of(identityAuthentication.getIdentity());
        }
        return Optional.empty();
    }

    /**
     * Identity of the caller on a route the filter already authenticated.
     *
     * @throws IllegalStateException if called on an unauthenticated request
     */
    public Identity require() {
        return get().orElseThrow(() -> new IllegalStateException("No authenticated identity on this request"));
    }
}
