package com.example.authservice.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;

/**
 * Authentication placed in the SecurityContext once a request passed the auth filter.
 *
 * Principal is the resolved {@link Identity}; authorities are a single ROLE_&lt;role&gt;.
 * Cannot be flipped back to unauthenticated or re-authenticated after construction.
 */
public class IdentityAuthentication extends AbstractAuthenticationToken {

    private final Identity identity;

    public IdentityAuthentication(Identity identity) {
        super(List.of(new SimpleGrantedAuthority("ROLE_" + identity.role().name())));
        this.identity = identity;
        super.setAuthenticated(true);
    }

    @Override
    public Identity getPrincipal() {
        return identity;
    }

    @Override
    public Object getCredentials() {
        return null;
    }

    @Override
    public String getName() {
        return identity.subjectId();
    }

    public Identity getIdentity() {
        return identity;
    }

    @Override
    public void setAuthenticated(boolean authenticated) {
        throw new IllegalArgumentException("IdentityAuthentication is immutable");
    }
}
