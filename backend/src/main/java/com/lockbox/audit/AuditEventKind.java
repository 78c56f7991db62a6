package com.lockbox.audit;

public enum AuditEventKind {
    VAULT_CREATED,
    AUTH_SUCCESS,
    AUTH_FAILURE,
    AUTH_LOCKED_OUT,
    LOGOUT,
    SESSION_EXPIRED,
    CREDENTIAL_ADDED,
    CREDENTIAL_UPDATED,
    CREDENTIAL_DELETED,
    CREDENTIAL_VIEWED,
    CREDENTIALS_LISTED,
    CREDENTIALS_SEARCHED,
    PASSPHRASE_CHANGED,
    PASSPHRASE_CHANGE_FAILED,
    VAULT_EXPORTED,
    VAULT_IMPORTED,
    VAULT_IMPORT_FAILED,
    SHARE_ISSUED,
    SHARE_REDEEMED,
    SHARE_REDEEM_FAILED
}
