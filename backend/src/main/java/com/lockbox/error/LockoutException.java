package com.lockbox.error;

import java.time.Instant;

/**
 * Authentication refused without attempting key derivation because of recent failures.
 */
public class LockoutException extends VaultException {

    private final Instant lockedUntil;

    public LockoutException(Instant lockedUntil) {
        super("Too many failed attempts; try again later");
        this.lockedUntil = lockedUntil;
    }

    public Instant lockedUntil() {
        return lockedUntil;
    }

    @Override
    public String code() {
        return "LOCKED_OUT";
    }
}
