package com.lockbox.share;

/**
 * The shareable fields of a credential, frozen at issuance. Never carries the
 * record id, tags, vault key or any other record.
 */
public record SharedCredential(
        String serviceName,
        String username,
        String secret,
        String url,
        String notes
) {

    @Override
    public String toString() {
        return "SharedCredential[serviceName=" + serviceName + ", username=" + username + ", secret=***]";
    }
}
