package com.lockbox.vault;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.lockbox.audit.AuditEventKind;
import com.lockbox.audit.AuditLog;
import com.lockbox.audit.AuditLogEntry;
import com.lockbox.crypto.CipherCodec;
import com.lockbox.crypto.KeyDerivation;
import com.lockbox.error.AuthenticationException;
import com.lockbox.error.IntegrityException;
import com.lockbox.error.NotFoundException;
import com.lockbox.error.SessionExpiredException;
import com.lockbox.error.VaultExistsException;
import com.lockbox.support.MutableClock;
import com.lockbox.support.StorageMapper;

import static org.junit.jupiter.api.Assertions.*;

/**
 * File-level behaviour of the vault container: persistence, tamper detection,
 * re-keying, export and import. Uses real crypto against a temp directory.
 */
class VaultStoreTest {

    private static final char[] MASTER = "Tr0ub4dor&3".toCharArray();
    private static final char[] EXPORT = "export-passphrase".toCharArray();

    @TempDir
    Path dir;

    private MutableClock clock;
    private AuditLog auditLog;
    private VaultStore store;

    @BeforeEach
    void setup() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        auditLog = new AuditLog(dir.resolve("vault.lbx.audit"), StorageMapper.create(), clock);
        store = newStore(dir.resolve("vault.lbx"));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private VaultStore newStore(Path path) {
        return new VaultStore(path, VaultStore.MIN_ITERATIONS, new KeyDerivation(), new CipherCodec(),
                auditLog, StorageMapper.create(), clock);
    }

    private static CredentialFields github() {
        return new CredentialFields("github", "alice", "s3cr3t", "https://github.com", null, Set.of("dev"));
    }

    private static CredentialFields bank() {
        return new CredentialFields("Bank", "alice@example.com", "hunter22", null, "checking account", Set.of("finance"));
    }

    private void flipByte(Path path, int index) throws IOException {
        byte[] data = Files.readAllBytes(path);
        data[index] ^= 0x01;
        Files.write(path, data);
    }

    /** Rewrites the big-endian iteration count that follows magic, version and salt. */
    private static byte[] withIterations(byte[] container, int iterations) {
        byte[] copy = container.clone();
        ByteBuffer.wrap(copy).putInt(3 + 1 + KeyDerivation.SALT_LENGTH, iterations);
        return copy;
    }

    private List<AuditEventKind> auditKinds() {
        return auditLog.entries().stream().map(AuditLogEntry::eventKind).toList();
    }

    // ── Create / open ─────────────────────────────────────────────────────────

    @Test
    void createdVaultRoundTripsRecords() {
        store.create(MASTER);
        String id;
        try (VaultHandle vault = store.open(MASTER)) {
            assertEquals(0, vault.size());
            id = vault.add(github()).id();
        }

        try (VaultHandle reopened = store.open(MASTER)) {
            CredentialRecord record = reopened.get(id);
            assertEquals("github", record.serviceName());
            assertEquals("alice", record.username());
            assertEquals("s3cr3t", record.secret());
            assertEquals(Set.of("dev"), record.tags());
        }
        assertEquals(List.of(AuditEventKind.VAULT_CREATED, AuditEventKind.CREDENTIAL_ADDED), auditKinds());
    }

    @Test
    void fileNeverContainsPlaintext() throws IOException {
        store.create(MASTER);
        try (VaultHandle vault = store.open(MASTER)) {
            vault.add(github());
        }

        String onDisk = new String(Files.readAllBytes(store.path()), StandardCharsets.ISO_8859_1);
        assertFalse(onDisk.contains("s3cr3t"), "Secret must not appear in the vault file");
        assertFalse(onDisk.contains("github"), "Service name must not appear in the vault file");
        assertFalse(Files.exists(store.path().resolveSibling("vault.lbx.tmp")), "Temp file must be renamed away");
    }

    @Test
    void createRefusesToOverwrite() {
        store.create(MASTER);
        assertThrows(VaultExistsException.class, () -> store.create("another-passphrase".toCharArray()));
    }

    @Test
    void createRejectsShortPassphrase() {
        assertThrows(IllegalArgumentException.class, () -> store.create("short".toCharArray()));
        assertFalse(store.exists());
    }

    @Test
    void constructorRejectsLowIterationCount() {
        assertThrows(IllegalArgumentException.class, () -> new VaultStore(dir.resolve("weak.lbx"),
                VaultStore.MIN_ITERATIONS - 1, new KeyDerivation(), new CipherCodec(), auditLog,
                StorageMapper.create(), clock));
    }

    @Test
    void constructorRejectsIterationCountAboveCeiling() {
        assertThrows(IllegalArgumentException.class, () -> new VaultStore(dir.resolve("slow.lbx"),
                VaultContainer.MAX_ITERATIONS + 1, new KeyDerivation(), new CipherCodec(), auditLog,
                StorageMapper.create(), clock));
    }

    @Test
    void openWithoutVaultIsNotFound() {
        assertThrows(NotFoundException.class, () -> store.open(MASTER));
    }

    @Test
    void wrongPassphraseIsRejected() {
        store.create(MASTER);
        assertThrows(AuthenticationException.class, () -> store.open("Tr0ub4dor&4".toCharArray()));
    }

    // ── Tamper detection ──────────────────────────────────────────────────────

    @Test
    void flippedCiphertextBitLooksLikeWrongPassphrase() throws IOException {
        store.create(MASTER);
        flipByte(store.path(), (int) Files.size(store.path()) - 1);

        assertThrows(AuthenticationException.class, () -> store.open(MASTER),
                "Corruption must be indistinguishable from a wrong passphrase on open");
        assertNotNull(store.checkIntegrity(), "Header is intact so the structural check still passes");
    }

    @Test
    void flippedHeaderBitIsDetected() throws IOException {
        store.create(MASTER);
        // salt byte: header is authenticated as associated data
        flipByte(store.path(), 5);

        assertThrows(AuthenticationException.class, () -> store.open(MASTER));
    }

    @Test
    void integrityCheckNamesTheDefect() throws IOException {
        store.create(MASTER);
        flipByte(store.path(), 0);

        IntegrityException e = assertThrows(IntegrityException.class, store::checkIntegrity);
        assertEquals("unrecognized container type", e.getMessage());

        Files.write(store.path(), new byte[10]);
        assertEquals("container truncated",
                assertThrows(IntegrityException.class, store::checkIntegrity).getMessage());
    }

    @Test
    void hugeIterationCountInHeaderFailsBeforeDerivation() throws IOException {
        store.create(MASTER);
        Files.write(store.path(), withIterations(Files.readAllBytes(store.path()), Integer.MAX_VALUE));

        IntegrityException e = assertThrows(IntegrityException.class, store::checkIntegrity);
        assertEquals("kdf iteration count above ceiling", e.getMessage());
        assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> assertThrows(AuthenticationException.class, () -> store.open(MASTER)),
                "Open must reject the header without running the key derivation");
    }

    @Test
    void integrityCheckReportsHeader() {
        store.create(MASTER);

        VaultHeader header = store.checkIntegrity();

        assertEquals(VaultContainer.FORMAT_VERSION, header.formatVersion());
        assertEquals(VaultStore.MIN_ITERATIONS, header.kdfIterations());
        assertEquals(KeyDerivation.SALT_LENGTH, header.salt().length);
    }

    // ── Mutations ─────────────────────────────────────────────────────────────

    @Test
    void updateChangesOnlyGivenFields() {
        store.create(MASTER);
        try (VaultHandle vault = store.open(MASTER)) {
            CredentialRecord added = vault.add(github());
            clock.advance(Duration.ofMinutes(1));

            CredentialRecord updated = vault.update(added.id(),
                    new CredentialFields(null, null, "n3w-s3cr3t", null, "rotated", null));

            assertEquals("github", updated.serviceName());
            assertEquals("alice", updated.username());
            assertEquals("n3w-s3cr3t", updated.secret());
            assertEquals("rotated", updated.notes());
            assertEquals(added.createdAt(), updated.createdAt());
            assertTrue(updated.updatedAt().isAfter(added.updatedAt()));
        }
        try (VaultHandle reopened = store.open(MASTER)) {
            assertEquals("n3w-s3cr3t", reopened.list().get(0).secret());
        }
    }

    @Test
    void unknownIdIsNotFound() {
        store.create(MASTER);
        try (VaultHandle vault = store.open(MASTER)) {
            assertThrows(NotFoundException.class, () -> vault.get("missing"));
            assertThrows(NotFoundException.class, () -> vault.update("missing", github()));
            assertThrows(NotFoundException.class, () -> vault.delete("missing"));
        }
    }

    @Test
    void deleteRemovesRecord() {
        store.create(MASTER);
        try (VaultHandle vault = store.open(MASTER)) {
            String id = vault.add(github()).id();
            vault.add(bank());
            vault.delete(id);
            assertEquals(1, vault.size());
        }
        try (VaultHandle reopened = store.open(MASTER)) {
            assertEquals("Bank", reopened.list().get(0).serviceName());
        }
    }

    @Test
    void addValidatesRequiredFields() {
        store.create(MASTER);
        try (VaultHandle vault = store.open(MASTER)) {
            assertThrows(IllegalArgumentException.class,
                    () -> vault.add(new CredentialFields(" ", "alice", "x", null, null, null)));
            assertThrows(IllegalArgumentException.class,
                    () -> vault.add(new CredentialFields("svc", "alice", null, null, null, null)));
            assertThrows(IllegalArgumentException.class,
                    () -> new CredentialFields("svc", "alice", "x", null, null, Set.of(" ")));
            assertEquals(0, vault.size());
        }
    }

    @Test
    void searchMatchesTextAndTags() {
        store.create(MASTER);
        try (VaultHandle vault = store.open(MASTER)) {
            vault.add(github());
            vault.add(bank());

            assertEquals(1, vault.search("GITHUB", null).size());
            assertEquals(2, vault.search("alice", null).size(), "Username matches too");
            assertEquals(1, vault.search("checking", null).size(), "Notes match too");
            assertEquals("Bank", vault.search(null, Set.of("finance")).get(0).serviceName());
            assertTrue(vault.search("github", Set.of("finance")).isEmpty());
            assertEquals(2, vault.search("", Set.of()).size());
        }
    }

    @Test
    void closedHandleRefusesAccess() {
        store.create(MASTER);
        VaultHandle vault = store.open(MASTER);
        vault.close();

        assertTrue(vault.isClosed());
        assertThrows(SessionExpiredException.class, vault::list);
        assertThrows(SessionExpiredException.class, () -> vault.add(github()));
    }

    // ── Passphrase change ─────────────────────────────────────────────────────

    @Test
    void changePassphraseRotatesSaltAndKey() throws IOException {
        store.create(MASTER);
        byte[] oldHeader = Arrays.copyOf(Files.readAllBytes(store.path()), VaultContainer.HEADER_LENGTH);
        char[] next = "correct horse battery".toCharArray();

        try (VaultHandle vault = store.open(MASTER)) {
            vault.add(github());
            vault.changePassphrase(MASTER, next);
            vault.add(bank());
        }

        byte[] newHeader = Arrays.copyOf(Files.readAllBytes(store.path()), VaultContainer.HEADER_LENGTH);
        assertFalse(Arrays.equals(oldHeader, newHeader), "Salt must be rotated");
        assertThrows(AuthenticationException.class, () -> store.open(MASTER));
        try (VaultHandle reopened = store.open(next)) {
            assertEquals(2, reopened.size());
        }
        assertTrue(auditKinds().contains(AuditEventKind.PASSPHRASE_CHANGED));
    }

    @Test
    void changePassphraseWithWrongOldPassphraseChangesNothing() throws IOException {
        store.create(MASTER);
        byte[] before = Files.readAllBytes(store.path());

        try (VaultHandle vault = store.open(MASTER)) {
            assertThrows(AuthenticationException.class,
                    () -> vault.changePassphrase("not-the-master".toCharArray(), "correct horse battery".toCharArray()));
        }

        assertArrayEquals(before, Files.readAllBytes(store.path()));
        assertTrue(auditKinds().contains(AuditEventKind.PASSPHRASE_CHANGE_FAILED));
    }

    // ── Export / import ───────────────────────────────────────────────────────

    @Test
    void exportImportsIntoAnotherVault() {
        store.create(MASTER);
        byte[] bundle;
        String githubId;
        try (VaultHandle vault = store.open(MASTER)) {
            githubId = vault.add(github()).id();
            vault.add(bank());
            bundle = vault.export(EXPORT);
        }

        VaultStore other = newStore(dir.resolve("other.lbx"));
        other.create("other-master-pass".toCharArray());
        try (VaultHandle target = other.open("other-master-pass".toCharArray())) {
            assertEquals(2, target.importBundle(bundle, EXPORT));
            assertEquals("s3cr3t", target.get(githubId).secret(), "Record ids survive the transfer");
        }
        try (VaultHandle reopened = other.open("other-master-pass".toCharArray())) {
            assertEquals(2, reopened.size(), "Import must be persisted");
        }
    }

    @Test
    void importReplacesRecordsWithSameId() {
        store.create(MASTER);
        try (VaultHandle vault = store.open(MASTER)) {
            CredentialRecord original = vault.add(github());
            byte[] bundle = vault.export(EXPORT);
            vault.update(original.id(), new CredentialFields(null, null, "changed", null, null, null));

            assertEquals(1, vault.importBundle(bundle, EXPORT));

            assertEquals(1, vault.size());
            assertEquals("s3cr3t", vault.get(original.id()).secret());
        }
    }

    @Test
    void tamperedBundleIsRejectedWholesale() {
        store.create(MASTER);
        try (VaultHandle vault = store.open(MASTER)) {
            vault.add(github());
            byte[] bundle = vault.export(EXPORT);
            bundle[bundle.length - 3] ^= 0x01;

            assertThrows(IntegrityException.class, () -> vault.importBundle(bundle, EXPORT));
            assertEquals(1, vault.size(), "Nothing may be merged from a tampered bundle");
        }
        assertTrue(auditKinds().contains(AuditEventKind.VAULT_IMPORT_FAILED));
    }

    @Test
    void bundleWithHugeIterationCountIsRejected() {
        store.create(MASTER);
        try (VaultHandle vault = store.open(MASTER)) {
            byte[] bundle = withIterations(vault.export(EXPORT), Integer.MAX_VALUE);

            IntegrityException e = assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> assertThrows(IntegrityException.class, () -> vault.importBundle(bundle, EXPORT)));
            assertEquals("kdf iteration count above ceiling", e.getMessage());
        }
        assertTrue(auditKinds().contains(AuditEventKind.VAULT_IMPORT_FAILED));
    }

    @Test
    void bundleNeedsItsOwnPassphrase() {
        store.create(MASTER);
        try (VaultHandle vault = store.open(MASTER)) {
            byte[] bundle = vault.export(EXPORT);

            assertThrows(IntegrityException.class, () -> vault.importBundle(bundle, MASTER));
            assertThrows(IllegalArgumentException.class, () -> vault.export("short".toCharArray()));
        }
    }

    @Test
    void vaultFileIsNotAnExportBundle() throws IOException {
        store.create(MASTER);
        byte[] vaultFile = Files.readAllBytes(store.path());
        try (VaultHandle vault = store.open(MASTER)) {
            assertThrows(IntegrityException.class, () -> vault.importBundle(vaultFile, MASTER));
        }
    }
}
