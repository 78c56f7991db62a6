package com.lockbox.error;

public class NotFoundException extends VaultException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException credential(String id) {
        return new NotFoundException("Credential not found: " + id);
    }

    public static NotFoundException vault() {
        return new NotFoundException("No vault exists at the configured location");
    }

    @Override
    public String code() {
        return "NOT_FOUND";
    }
}
