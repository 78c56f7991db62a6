package com.lockbox.error;

/**
 * Share token is past its expiry or has already been redeemed.
 */
public class TokenExpiredException extends VaultException {

    public TokenExpiredException() {
        super("Share token expired or already used");
    }

    @Override
    public String code() {
        return "TOKEN_EXPIRED";
    }
}
