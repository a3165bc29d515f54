package com.example.authservice.config;

import com.example.authservice.security.AccessPolicy;
import com.example.authservice.security.AccessRuleTable;
import com.example.authservice.security.IdentityResolver;
import com.example.authservice.security.SessionStore;
import com.example.authservice.security.TokenCodec;
import com.example.authservice.security.UserDirectory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the auth pipeline: codec, resolver and policy.
 * The signing secret is read once here; a weak or missing secret fails startup.
 */
@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class TokenConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenCodec tokenCodec(AuthProperties properties, Clock clock) {
        AuthProperties.Jwt jwt = properties.getJwt();
        return new TokenCodec(jwt.getSecret(), jwt.getIssuer(), jwt.getClockSkew(), clock);
    }

    @Bean
    public IdentityResolver identityResolver(UserDirectory userDirectory, SessionStore sessionStore) {
        return new IdentityResolver(userDirectory, sessionStore);
    }

    @Bean
    public AccessPolicy accessPolicy(AccessRuleTable accessRuleTable) {
        return new AccessPolicy(accessRuleTable);
    }
}
