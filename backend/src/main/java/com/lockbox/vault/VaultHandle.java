package com.lockbox.vault;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;

import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lockbox.audit.AuditEventKind;
import com.lockbox.crypto.SecretBytes;
import com.lockbox.error.AuthenticationException;
import com.lockbox.error.IntegrityException;
import com.lockbox.error.NotFoundException;
import com.lockbox.error.SessionExpiredException;

/**
 * An unlocked vault: the decrypted record collection plus the key that seals it.
 *
 * <p>All methods are serialized on the handle. Every mutation builds the new
 * collection, rewrites the file through {@link VaultStore#write}, and only then
 * swaps the in-memory state, so a failed write leaves both the file and this
 * handle exactly as they were.
 *
 * <p>Closing the handle zeroes the key; any later call fails with
 * {@link SessionExpiredException}.
 */
public class VaultHandle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VaultHandle.class);

    private final VaultStore store;
    private final Instant createdAt;
    private SecretBytes key;
    private byte[] salt;
    private int kdfIterations;
    private Map<String, CredentialRecord> records;
    private boolean closed;

    VaultHandle(VaultStore store, SecretBytes key, byte[] salt, int kdfIterations, VaultPayload payload) {
        this.store = store;
        this.key = key;
        this.salt = salt.clone();
        this.kdfIterations = kdfIterations;
        this.createdAt = payload.createdAt();
        this.records = new LinkedHashMap<>();
        for (CredentialRecord record : payload.records()) {
            records.put(record.id(), record);
        }
    }

    public synchronized CredentialRecord add(CredentialFields fields) {
        requireOpen();
        fields.validateForCreate();
        Instant now = store.now();
        CredentialRecord record = new CredentialRecord(
                UUID.randomUUID().toString(),
                fields.serviceName().trim(),
                fields.username(),
                fields.secret(),
                fields.url(),
                fields.notes(),
                fields.tags(),
                now,
                now);

        Map<String, CredentialRecord> next = new LinkedHashMap<>(records);
        next.put(record.id(), record);
        commit(next);
        store.auditLog().append(AuditEventKind.CREDENTIAL_ADDED, record.id());
        return record;
    }

    public synchronized CredentialRecord update(String id, CredentialFields changes) {
        requireOpen();
        changes.validateForUpdate();
        CredentialRecord existing = records.get(id);
        if (existing == null) {
            throw NotFoundException.credential(id);
        }
        CredentialRecord updated = existing.withFields(changes, store.now());

        Map<String, CredentialRecord> next = new LinkedHashMap<>(records);
        next.put(id, updated);
        commit(next);
        store.auditLog().append(AuditEventKind.CREDENTIAL_UPDATED, id);
        return updated;
    }

    public synchronized void delete(String id) {
        requireOpen();
        if (!records.containsKey(id)) {
            throw NotFoundException.credential(id);
        }
        Map<String, CredentialRecord> next = new LinkedHashMap<>(records);
        next.remove(id);
        commit(next);
        store.auditLog().append(AuditEventKind.CREDENTIAL_DELETED, id);
    }

    public synchronized CredentialRecord get(String id) {
        requireOpen();
        CredentialRecord record = records.get(id);
        if (record == null) {
            throw NotFoundException.credential(id);
        }
        return record;
    }

    public synchronized List<CredentialRecord> list() {
        requireOpen();
        return List.copyOf(records.values());
    }

    /** Linear scan; vault sizes are bounded by what a person keeps, so there is no index. */
    public synchronized List<CredentialRecord> search(Predicate<CredentialRecord> predicate) {
        requireOpen();
        List<CredentialRecord> matches = new ArrayList<>();
        for (CredentialRecord record : records.values()) {
            if (predicate.test(record)) {
                matches.add(record);
            }
        }
        return matches;
    }

    /**
     * Case-insensitive substring match on service name, username, url and notes,
     * intersected with "has any of these tags". Null or empty arguments match everything.
     */
    public List<CredentialRecord> search(String query, Set<String> tags) {
        return search(matching(query, tags));
    }

    static Predicate<CredentialRecord> matching(String query, Set<String> tags) {
        Predicate<CredentialRecord> predicate = record -> true;
        if (query != null && !query.isBlank()) {
            String needle = query.toLowerCase(Locale.ROOT);
            predicate = predicate.and(record -> contains(record.serviceName(), needle)
                    || contains(record.username(), needle)
                    || contains(record.url(), needle)
                    || contains(record.notes(), needle));
        }
        if (tags != null && !tags.isEmpty()) {
            predicate = predicate.and(record -> record.tags().stream().anyMatch(tags::contains));
        }
        return predicate;
    }

    /**
     * Re-keys the vault under {@code newPassphrase} with a freshly generated salt and the
     * store's current iteration count.
     *
     * @throws AuthenticationException if {@code oldPassphrase} is not the current passphrase
     */
    public synchronized void changePassphrase(char[] oldPassphrase, char[] newPassphrase) {
        requireOpen();
        VaultStore.requireStrongPassphrase(newPassphrase);
        try (SecretBytes candidate = store.keyDerivation().derive(oldPassphrase, salt, kdfIterations)) {
            if (!Arrays.constantTimeAreEqual(candidate.reveal(), key.reveal())) {
                store.auditLog().append(AuditEventKind.PASSPHRASE_CHANGE_FAILED, null);
                throw new AuthenticationException();
            }
        }

        byte[] newSalt = store.keyDerivation().newSalt();
        int newIterations = store.kdfIterations();
        SecretBytes newKey = store.keyDerivation().derive(newPassphrase, newSalt, newIterations);
        try {
            store.write(newKey, newSalt, newIterations, new VaultPayload(createdAt, new ArrayList<>(records.values())));
        } catch (RuntimeException e) {
            newKey.close();
            throw e;
        }
        key.close();
        key = newKey;
        salt = newSalt;
        kdfIterations = newIterations;
        store.auditLog().append(AuditEventKind.PASSPHRASE_CHANGED, null);
        log.info("Master passphrase changed for {}; salt rotated", store.path());
    }

    /** Self-contained encrypted copy of every record, independent of the vault key. */
    public synchronized byte[] export(char[] exportPassphrase) {
        requireOpen();
        byte[] bundle = store.sealBundle(new ArrayList<>(records.values()), exportPassphrase);
        store.auditLog().append(AuditEventKind.VAULT_EXPORTED, null);
        log.info("Exported {} records from {}", records.size(), store.path());
        return bundle;
    }

    /**
     * Merges every record of an export bundle in one write. Records whose id already
     * exists are replaced.
     *
     * @return number of records imported
     * @throws IntegrityException on tampering or a wrong export passphrase; nothing is merged
     */
    public synchronized int importBundle(byte[] bundle, char[] exportPassphrase) {
        requireOpen();
        List<CredentialRecord> imported;
        try {
            imported = store.openBundle(bundle, exportPassphrase);
        } catch (IntegrityException e) {
            store.auditLog().append(AuditEventKind.VAULT_IMPORT_FAILED, null);
            log.warn("Rejected import bundle: {}", e.getMessage());
            throw e;
        }
        Map<String, CredentialRecord> next = new LinkedHashMap<>(records);
        for (CredentialRecord record : imported) {
            next.put(record.id(), record);
        }
        commit(next);
        store.auditLog().append(AuditEventKind.VAULT_IMPORTED, null);
        log.info("Imported {} records into {}", imported.size(), store.path());
        return imported.size();
    }

    public synchronized int size() {
        requireOpen();
        return records.size();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public int formatVersion() {
        return VaultContainer.FORMAT_VERSION;
    }

    public synchronized int kdfIterations() {
        return kdfIterations;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /** Zeroes the key and drops the decrypted records. Idempotent. */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        key.close();
        records = Map.of();
        closed = true;
    }

    private void commit(Map<String, CredentialRecord> next) {
        store.write(key, salt, kdfIterations, new VaultPayload(createdAt, new ArrayList<>(next.values())));
        records = next;
    }

    private void requireOpen() {
        if (closed) {
            throw new SessionExpiredException();
        }
    }

    private static boolean contains(String field, String needle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(needle);
    }
}
