package com.lockbox.vault;

import java.time.Instant;
import java.util.Set;

/**
 * A stored credential. Lives only inside the decrypted record collection of an
 * unlocked vault and is never written to disk unencrypted.
 */
public record CredentialRecord(
        String id,
        String serviceName,
        String username,
        String secret,
        String url,
        String notes,
        Set<String> tags,
        Instant createdAt,
        Instant updatedAt
) {

    public CredentialRecord {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    CredentialRecord withFields(CredentialFields changes, Instant now) {
        return new CredentialRecord(
                id,
                changes.serviceName() != null ? changes.serviceName().trim() : serviceName,
                changes.username() != null ? changes.username() : username,
                changes.secret() != null ? changes.secret() : secret,
                changes.url() != null ? changes.url() : url,
                changes.notes() != null ? changes.notes() : notes,
                changes.tags() != null ? changes.tags() : tags,
                createdAt,
                now);
    }

    @Override
    public String toString() {
        return "CredentialRecord[id=" + id + ", serviceName=" + serviceName + ", username=" + username
                + ", secret=***, tags=" + tags + "]";
    }
}
