package com.lockbox.error;

/**
 * Root of the engine's failure taxonomy.
 *
 * The set of subclasses is closed: constructors are package-private, so callers
 * can switch over the known kinds instead of catching a broad exception class.
 * Messages are fixed strings and never carry passphrases, keys or secrets.
 */
public abstract class VaultException extends RuntimeException {

    VaultException(String message) {
        super(message);
    }

    VaultException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable machine-readable code used by the presentation layer. */
    public abstract String code();
}
