package com.lockbox.vault;

import java.time.Instant;
import java.util.List;

/**
 * Plaintext inside an export bundle.
 */
public record ExportPayload(int formatVersion, Instant exportedAt, List<CredentialRecord> records) {

    public ExportPayload {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
