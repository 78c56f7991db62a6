package com.lockbox.share;

import java.time.Instant;
import java.util.Arrays;

/**
 * Server-side state of one share. The snapshot is held sealed under a key that
 * only the token holder has; it is wiped on redemption, burn or expiry, leaving
 * a tombstone so later redemptions still report expiry.
 */
final class ShareToken {

    private final String tokenId;
    private final String credentialId;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final byte[] passphraseSalt;
    private final byte[] passphraseHash;
    private byte[] sealedSnapshot;
    private boolean redeemed;
    private int failedAttempts;

    ShareToken(String tokenId, String credentialId, Instant issuedAt, Instant expiresAt,
               byte[] sealedSnapshot, byte[] passphraseSalt, byte[] passphraseHash) {
        this.tokenId = tokenId;
        this.credentialId = credentialId;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.sealedSnapshot = sealedSnapshot;
        this.passphraseSalt = passphraseSalt;
        this.passphraseHash = passphraseHash;
    }

    String tokenId() {
        return tokenId;
    }

    String credentialId() {
        return credentialId;
    }

    Instant issuedAt() {
        return issuedAt;
    }

    Instant expiresAt() {
        return expiresAt;
    }

    boolean passphraseProtected() {
        return passphraseHash != null;
    }

    byte[] passphraseSalt() {
        return passphraseSalt;
    }

    byte[] passphraseHash() {
        return passphraseHash;
    }

    byte[] sealedSnapshot() {
        return sealedSnapshot;
    }

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /** True once redeemed, burned or expired. */
    boolean isSpent(Instant now) {
        return redeemed || isExpired(now);
    }

    int recordFailedAttempt() {
        return ++failedAttempts;
    }

    void markRedeemed() {
        redeemed = true;
        wipe();
    }

    void wipe() {
        if (sealedSnapshot != null) {
            Arrays.fill(sealedSnapshot, (byte) 0);
            sealedSnapshot = null;
        }
    }
}
