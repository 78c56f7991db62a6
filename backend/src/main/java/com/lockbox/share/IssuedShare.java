package com.lockbox.share;

import java.time.Instant;

/**
 * Result of issuing a share. {@code token} is the only copy of the key that
 * unlocks the snapshot; it is not retained by the service.
 */
public record IssuedShare(
        String token,
        String tokenId,
        String credentialId,
        Instant issuedAt,
        Instant expiresAt,
        boolean passphraseProtected
) {

    @Override
    public String toString() {
        return "IssuedShare[tokenId=" + tokenId + ", credentialId=" + credentialId + ", expiresAt=" + expiresAt + "]";
    }
}
