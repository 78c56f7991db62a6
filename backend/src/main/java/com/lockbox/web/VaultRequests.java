package com.lockbox.web;

import java.time.Instant;
import java.util.Set;

import com.lockbox.vault.CredentialFields;

/**
 * Request and response bodies of the HTTP layer.
 */
public final class VaultRequests {

    private VaultRequests() {
    }

    public record PassphraseRequest(String passphrase) {}

    public record ChangePassphraseRequest(String oldPassphrase, String newPassphrase) {}

    public record SessionResponse(String sessionId, Instant createdAt) {}

    public record ExistsResponse(boolean exists) {}

    public record CredentialRequest(
            String serviceName,
            String username,
            String secret,
            String url,
            String notes,
            Set<String> tags
    ) {
        CredentialFields toFields() {
            return new CredentialFields(serviceName, username, secret, url, notes, tags);
        }
    }

    public record SearchRequest(String query, Set<String> tags) {}

    public record ExportRequest(String exportPassphrase) {}

    public record ExportResponse(String bundle) {}      // Base64

    public record ImportRequest(String bundle, String exportPassphrase) {}

    public record ImportResponse(int imported) {}

    public record ShareRequest(String credentialId, Long ttlSeconds, String sharePassphrase) {}

    public record ShareResponse(String token, String tokenId, Instant expiresAt, boolean passphraseProtected) {}

    public record RedeemRequest(String sharePassphrase) {}

    public record PasswordRequest(
            Integer length,
            Boolean uppercase,
            Boolean lowercase,
            Boolean digits,
            Boolean symbols,
            Boolean excludeAmbiguous
    ) {}

    public record PasswordResponse(String password, String strength, double entropyBits) {}

    public record IntegrityResponse(int formatVersion, int kdfIterations) {}

    public record VerifyResponse(int verifiedEntries) {}

    public record ErrorResponse(String error, String message) {}
}
