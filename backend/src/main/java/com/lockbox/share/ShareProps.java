package com.lockbox.share;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lockbox.share")
public record ShareProps(
        Duration defaultTtl,
        Duration maxTtl,
        Integer passphraseIterations,
        Integer maxRedeemAttempts
) {

    public ShareProps {
        defaultTtl = defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()
                ? Duration.ofHours(1) : defaultTtl;
        maxTtl = maxTtl == null || maxTtl.isNegative() || maxTtl.isZero() ? Duration.ofDays(7) : maxTtl;
        passphraseIterations = passphraseIterations == null || passphraseIterations < 1
                ? 100_000 : passphraseIterations;
        maxRedeemAttempts = maxRedeemAttempts == null || maxRedeemAttempts < 1 ? 5 : maxRedeemAttempts;
    }

    public static ShareProps defaults() {
        return new ShareProps(null, null, null, null);
    }
}
