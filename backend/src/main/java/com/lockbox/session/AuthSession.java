package com.lockbox.session;

import java.time.Instant;

import com.lockbox.vault.VaultHandle;

/**
 * In-memory proof of a successful unlock. The derived key lives inside the
 * {@link VaultHandle} and is zeroed when the session ends. Never persisted.
 */
public final class AuthSession {

    private final String sessionId;
    private final String vaultIdentity;
    private final VaultHandle vault;
    private final Instant createdAt;
    private volatile Instant lastActivityAt;

    AuthSession(String sessionId, String vaultIdentity, VaultHandle vault, Instant createdAt) {
        this.sessionId = sessionId;
        this.vaultIdentity = vaultIdentity;
        this.vault = vault;
        this.createdAt = createdAt;
        this.lastActivityAt = createdAt;
    }

    public String sessionId() {
        return sessionId;
    }

    public String vaultIdentity() {
        return vaultIdentity;
    }

    public VaultHandle vault() {
        return vault;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastActivityAt() {
        return lastActivityAt;
    }

    void touch(Instant now) {
        lastActivityAt = now;
    }

    /** Zeroes the key. */
    void end() {
        vault.close();
    }

    public boolean isEnded() {
        return vault.isClosed();
    }

    @Override
    public String toString() {
        return "AuthSession[" + sessionId + ", vault=" + vaultIdentity + "]";
    }
}
