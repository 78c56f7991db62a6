package com.lockbox.session;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lockbox.session")
public record SessionProps(
        Duration timeout,
        Integer maxFailedAttempts,
        Duration lockoutDuration,
        Duration failureWindow
) {

    public SessionProps {
        timeout = positiveOr(timeout, Duration.ofMinutes(5));
        maxFailedAttempts = maxFailedAttempts == null || maxFailedAttempts < 1 ? 5 : maxFailedAttempts;
        lockoutDuration = positiveOr(lockoutDuration, Duration.ofMinutes(5));
        failureWindow = positiveOr(failureWindow, Duration.ofMinutes(5));
    }

    public static SessionProps defaults() {
        return new SessionProps(null, null, null, null);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}
