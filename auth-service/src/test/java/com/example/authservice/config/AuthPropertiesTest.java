package com.example.authservice.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AuthPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesOnly.class)
            .withPropertyValues(
                    "auth.jwt.secret=test-signing-key-0123456789-ABCDEFGHIJ-abcdefghij-XYZ",
                    "auth.jwt.access-token-ttl=15m",
                    "auth.jwt.refresh-token-ttl=7d",
                    "auth.jwt.clock-skew=30s");

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(AuthProperties.class)
    static class PropertiesOnly {
    }

    @Test
    void validConfigurationBinds() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            AuthProperties properties = context.getBean(AuthProperties.class);
            assertEquals(Duration.ofMinutes(15), properties.getJwt().getAccessTokenTtl());
            assertEquals(Duration.ofSeconds(30), properties.getJwt().getClockSkew());
        });
    }

    @ParameterizedTest
    @ValueSource(strings = {"0s", "-5m", "500ms"})
    void accessTtlBelowOneSecondAbortsStartup(String ttl) {
        contextRunner.withPropertyValues("auth.jwt.access-token-ttl=" + ttl)
                .run(context -> assertBindingFailed(context.getStartupFailure()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0s", "-1d"})
    void refreshTtlBelowOneSecondAbortsStartup(String ttl) {
        contextRunner.withPropertyValues("auth.jwt.refresh-token-ttl=" + ttl)
                .run(context -> assertBindingFailed(context.getStartupFailure()));
    }

    @Test
    void negativeClockSkewAbortsStartup() {
        contextRunner.withPropertyValues("auth.jwt.clock-skew=-1s")
                .run(context -> assertBindingFailed(context.getStartupFailure()));
    }

    @Test
    void zeroClockSkewIsAccepted() {
        contextRunner.withPropertyValues("auth.jwt.clock-skew=0s")
                .run(context -> assertNull(context.getStartupFailure()));
    }

    @Test
    void refreshTtlMustExceedAccessTtl() {
        contextRunner.withPropertyValues("auth.jwt.access-token-ttl=1h", "auth.jwt.refresh-token-ttl=30m")
                .run(context -> assertBindingFailed(context.getStartupFailure()));
    }

    @Test
    void missingSecretAbortsStartup() {
        new ApplicationContextRunner()
                .withUserConfiguration(PropertiesOnly.class)
                .run(context -> assertBindingFailed(context.getStartupFailure()));
    }

    private static void assertBindingFailed(Throwable failure) {
        assertNotNull(failure, "context should not start");
        Throwable cause = failure;
        while (cause != null && !(cause instanceof BindValidationException)) {
            cause = cause.getCause();
        }
        assertNotNull(cause, () -> "expected a bind validation failure, got " + failure);
    }
}
