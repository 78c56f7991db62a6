package com.lockbox.error;

/**
 * Wrong passphrase or unreadable vault. The two are intentionally indistinguishable.
 */
public class AuthenticationException extends VaultException {

    public AuthenticationException() {
        super("Invalid credentials");
    }

    public AuthenticationException(String message) {
        super(message);
    }

    @Override
    public String code() {
        return "INVALID_CREDENTIALS";
    }
}
