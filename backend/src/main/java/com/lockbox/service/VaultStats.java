package com.lockbox.service;

import java.time.Instant;

public record VaultStats(
        int totalCredentials,
        Instant createdAt,
        Instant lastAccessedAt,
        long vaultSizeBytes,
        int kdfIterations,
        int formatVersion
) {}
