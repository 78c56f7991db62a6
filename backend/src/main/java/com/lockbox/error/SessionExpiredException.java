package com.lockbox.error;

public class SessionExpiredException extends VaultException {

    public SessionExpiredException() {
        super("Session expired or unknown; authenticate again");
    }

    @Override
    public String code() {
        return "SESSION_EXPIRED";
    }
}
