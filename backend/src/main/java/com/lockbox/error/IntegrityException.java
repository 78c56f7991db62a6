package com.lockbox.error;

/**
 * Authenticated decryption failed, or a container is structurally malformed.
 * Terminal for the blob it was raised on.
 */
public class IntegrityException extends VaultException {

    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "INTEGRITY_FAILURE";
    }
}
