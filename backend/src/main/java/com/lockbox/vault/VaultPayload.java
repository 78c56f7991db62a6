package com.lockbox.vault;

import java.time.Instant;
import java.util.List;

/**
 * Plaintext inside a vault file. Only ever exists in memory.
 */
public record VaultPayload(Instant createdAt, List<CredentialRecord> records) {

    public VaultPayload {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
