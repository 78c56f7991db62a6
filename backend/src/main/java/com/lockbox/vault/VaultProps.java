package com.lockbox.vault;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lockbox.vault")
public record VaultProps(
        String path,
        Integer kdfIterations
) {

    public VaultProps {
        path = path == null || path.isBlank() ? "./data/vault.lbx" : path;
        kdfIterations = kdfIterations == null ? 100_000 : kdfIterations;
    }
}
