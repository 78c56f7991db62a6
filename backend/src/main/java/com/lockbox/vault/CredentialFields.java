package com.lockbox.vault;

import java.util.Set;

/**
 * Caller-supplied credential fields. On add, {@code serviceName}, {@code username} and
 * {@code secret} are required; on update a null field means "leave unchanged".
 */
public record CredentialFields(
        String serviceName,
        String username,
        String secret,
        String url,
        String notes,
        Set<String> tags
) {

    public static final int MAX_TAGS = 32;

    public CredentialFields {
        if (tags != null) {
            for (String tag : tags) {
                if (tag == null || tag.isBlank()) {
                    throw new IllegalArgumentException("tags must not be blank");
                }
            }
            if (tags.size() > MAX_TAGS) {
                throw new IllegalArgumentException("at most " + MAX_TAGS + " tags are allowed");
            }
            tags = Set.copyOf(tags);
        }
    }

    void validateForCreate() {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName is required");
        }
        if (username == null) {
            throw new IllegalArgumentException("username is required");
        }
        if (secret == null) {
            throw new IllegalArgumentException("secret is required");
        }
    }

    void validateForUpdate() {
        if (serviceName != null && serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be blank");
        }
    }

    @Override
    public String toString() {
        return "CredentialFields[serviceName=" + serviceName + ", username=" + username + ", secret=***]";
    }
}
