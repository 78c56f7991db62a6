package com.lockbox.error;

public class VaultExistsException extends VaultException {

    public VaultExistsException() {
        super("A vault already exists at the configured location");
    }

    @Override
    public String code() {
        return "VAULT_EXISTS";
    }
}
