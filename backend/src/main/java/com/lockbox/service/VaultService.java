package com.lockbox.service;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.lockbox.audit.AuditEventKind;
import com.lockbox.audit.AuditLog;
import com.lockbox.audit.AuditLogEntry;
import com.lockbox.crypto.PasswordGenerator;
import com.lockbox.error.LockoutException;
import com.lockbox.error.SessionExpiredException;
import com.lockbox.session.AuthSession;
import com.lockbox.session.AuthSessionManager;
import com.lockbox.share.IssuedShare;
import com.lockbox.share.SharedCredential;
import com.lockbox.share.ShareTokenService;
import com.lockbox.vault.CredentialFields;
import com.lockbox.vault.CredentialRecord;
import com.lockbox.vault.VaultHandle;
import com.lockbox.vault.VaultHeader;
import com.lockbox.vault.VaultStore;

/**
 * The operations offered to presentation layers (HTTP, CLI).
 *
 * <p>Every session-scoped call first resolves the session, which rejects
 * unknown and idle-expired sessions with {@link SessionExpiredException} and
 * records activity on live ones. Failures surface as the closed
 * {@link com.lockbox.error.VaultException} taxonomy.
 */
@Service
public class VaultService {

    private static final Logger log = LoggerFactory.getLogger(VaultService.class);

    private final VaultStore vaultStore;
    private final AuthSessionManager sessions;
    private final ShareTokenService shares;
    private final AuditLog auditLog;
    private final PasswordGenerator passwordGenerator;

    public VaultService(VaultStore vaultStore,
                        AuthSessionManager sessions,
                        ShareTokenService shares,
                        AuditLog auditLog,
                        PasswordGenerator passwordGenerator) {
        this.vaultStore = vaultStore;
        this.sessions = sessions;
        this.shares = shares;
        this.auditLog = auditLog;
        this.passwordGenerator = passwordGenerator;
    }

    // ── Vault lifecycle and authentication ──────────────────────────────────

    public boolean vaultExists() {
        return vaultStore.exists();
    }

    public void createVault(char[] passphrase) {
        vaultStore.create(passphrase);
    }

    /**
     * @throws LockoutException while the vault is locked out, even for the right passphrase
     */
    public AuthSession authenticate(char[] passphrase) {
        return sessions.authenticate(vaultStore, passphrase);
    }

    public void logout(String sessionId) {
        sessions.logout(sessionId);
    }

    public AuthStatus authStatus(String sessionId) {
        var lockedUntil = sessions.lockedUntil(vaultStore);
        return new AuthStatus(
                vaultStore.exists(),
                sessions.find(sessionId).isPresent(),
                lockedUntil.isPresent(),
                lockedUntil.orElse(null));
    }

    // ── Credentials ─────────────────────────────────────────────────────────

    public List<CredentialRecord> listCredentials(String sessionId) {
        List<CredentialRecord> records = vault(sessionId).list();
        auditLog.append(AuditEventKind.CREDENTIALS_LISTED, null);
        return records;
    }

    public CredentialRecord getCredential(String sessionId, String credentialId) {
        CredentialRecord record = vault(sessionId).get(credentialId);
        auditLog.append(AuditEventKind.CREDENTIAL_VIEWED, credentialId);
        return record;
    }

    public CredentialRecord addCredential(String sessionId, CredentialFields fields) {
        return vault(sessionId).add(fields);
    }

    public CredentialRecord updateCredential(String sessionId, String credentialId, CredentialFields fields) {
        return vault(sessionId).update(credentialId, fields);
    }

    public void deleteCredential(String sessionId, String credentialId) {
        vault(sessionId).delete(credentialId);
    }

    public List<CredentialRecord> search(String sessionId, String query, Set<String> tags) {
        List<CredentialRecord> results = vault(sessionId).search(query, tags);
        auditLog.append(AuditEventKind.CREDENTIALS_SEARCHED, null);
        return results;
    }

    // ── Passphrase, export, import ──────────────────────────────────────────

    public void changePassphrase(String sessionId, char[] oldPassphrase, char[] newPassphrase) {
        vault(sessionId).changePassphrase(oldPassphrase, newPassphrase);
    }

    public byte[] exportVault(String sessionId, char[] exportPassphrase) {
        return vault(sessionId).export(exportPassphrase);
    }

    /**
     * Import needs an unlocked vault because the merged collection is re-sealed
     * under the live vault key.
     */
    public int importVault(String sessionId, byte[] bundle, char[] exportPassphrase) {
        return vault(sessionId).importBundle(bundle, exportPassphrase);
    }

    // ── Sharing ─────────────────────────────────────────────────────────────

    public IssuedShare issueShare(String sessionId, String credentialId, Duration ttl, char[] sharePassphrase) {
        return shares.issue(vault(sessionId), credentialId, ttl, sharePassphrase);
    }

    /** Needs no session: the token carries everything required. */
    public SharedCredential redeemShare(String token, char[] sharePassphrase) {
        return shares.redeem(token, sharePassphrase);
    }

    // ── Audit and diagnostics ───────────────────────────────────────────────

    /** The whole chain, oldest first. */
    public List<AuditLogEntry> readAuditLog(String sessionId) {
        sessions.require(sessionId);
        return auditLog.entries();
    }

    public List<AuditLogEntry> readAuditLog(String sessionId, int limit) {
        sessions.require(sessionId);
        return auditLog.recent(limit);
    }

    public int verifyAuditLog(String sessionId) {
        sessions.require(sessionId);
        return auditLog.verifyChain();
    }

    public VaultStats vaultStats(String sessionId) {
        AuthSession session = sessions.require(sessionId);
        VaultHandle vault = session.vault();
        return new VaultStats(
                vault.size(),
                vault.createdAt(),
                session.lastActivityAt(),
                vaultStore.sizeBytes(),
                vault.kdfIterations(),
                vault.formatVersion());
    }

    /** Structural check for recovery tooling; needs no passphrase. */
    public VaultHeader checkIntegrity() {
        return vaultStore.checkIntegrity();
    }

    // ── Password tools ──────────────────────────────────────────────────────

    public String generatePassword(PasswordGenerator.Options options) {
        return passwordGenerator.generate(options);
    }

    public PasswordGenerator.Strength estimateStrength(String password) {
        return passwordGenerator.estimateStrength(password);
    }

    // ── Housekeeping ────────────────────────────────────────────────────────

    @Scheduled(fixedDelayString = "${lockbox.session.sweep-interval-ms:60000}")
    public void sweep() {
        int expired = sessions.expireIdleSessions();
        int purged = shares.purgeStale();
        if (expired > 0 || purged > 0) {
            log.debug("Housekeeping ended {} idle sessions and purged {} share tombstones", expired, purged);
        }
    }

    private VaultHandle vault(String sessionId) {
        return sessions.require(sessionId).vault();
    }
}
