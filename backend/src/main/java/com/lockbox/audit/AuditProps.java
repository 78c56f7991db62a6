package com.lockbox.audit;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code path} defaults to the vault path with an {@code .audit} suffix.
 */
@ConfigurationProperties(prefix = "lockbox.audit")
public record AuditProps(
        String path
) {
}
