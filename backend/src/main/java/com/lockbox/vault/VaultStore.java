package com.lockbox.vault;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lockbox.audit.AuditEventKind;
import com.lockbox.audit.AuditLog;
import com.lockbox.crypto.CipherCodec;
import com.lockbox.crypto.KeyDerivation;
import com.lockbox.crypto.SecretBytes;
import com.lockbox.error.AuthenticationException;
import com.lockbox.error.IntegrityException;
import com.lockbox.error.NotFoundException;
import com.lockbox.error.VaultExistsException;

/**
 * Durable container for one vault file.
 *
 * <p>Every write goes to a sibling temp file which is forced to disk and then
 * renamed over the vault, so a crash mid-write leaves the previous vault intact.
 *
 * <p><strong>Open contract:</strong> {@link #open} reports a wrong passphrase and a
 * damaged file with the same {@link AuthenticationException}. Callers that need to
 * tell corruption apart use {@link #checkIntegrity()}, which inspects structure only.
 */
public class VaultStore {

    private static final Logger log = LoggerFactory.getLogger(VaultStore.class);

    public static final int MIN_ITERATIONS = 100_000;
    public static final int MIN_PASSPHRASE_LENGTH = 8;

    private final Path path;
    private final int kdfIterations;
    private final KeyDerivation keyDerivation;
    private final CipherCodec cipherCodec;
    private final AuditLog auditLog;
    private final ObjectMapper mapper;
    private final Clock clock;

    public VaultStore(Path path,
                      int kdfIterations,
                      KeyDerivation keyDerivation,
                      CipherCodec cipherCodec,
                      AuditLog auditLog,
                      ObjectMapper mapper,
                      Clock clock) {
        if (kdfIterations < MIN_ITERATIONS || kdfIterations > VaultContainer.MAX_ITERATIONS) {
            throw new IllegalArgumentException("kdf iterations must be between " + MIN_ITERATIONS
                    + " and " + VaultContainer.MAX_ITERATIONS);
        }
        this.path = path.toAbsolutePath().normalize();
        this.kdfIterations = kdfIterations;
        this.keyDerivation = keyDerivation;
        this.cipherCodec = cipherCodec;
        this.auditLog = auditLog;
        this.mapper = mapper;
        this.clock = clock;
    }

    /** Stable identity used to key per-vault state such as lockouts. */
    public String identity() {
        return path.toString();
    }

    public Path path() {
        return path;
    }

    public boolean exists() {
        return Files.isRegularFile(path);
    }

    public long sizeBytes() {
        try {
            return exists() ? Files.size(path) : 0L;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat vault " + path, e);
        }
    }

    public synchronized void create(char[] passphrase) {
        requireStrongPassphrase(passphrase);
        if (exists()) {
            throw new VaultExistsException();
        }
        byte[] salt = keyDerivation.newSalt();
        try (SecretBytes key = keyDerivation.derive(passphrase, salt, kdfIterations)) {
            write(key, salt, kdfIterations, new VaultPayload(clock.instant(), List.of()));
        }
        auditLog.append(AuditEventKind.VAULT_CREATED, null);
        log.info("Created vault at {} ({} kdf iterations)", path, kdfIterations);
    }

    /**
     * Derives the key from the stored salt and iteration count and decrypts the vault.
     *
     * @throws AuthenticationException for a wrong passphrase or an unreadable file, indistinguishably
     * @throws NotFoundException if there is no vault at all
     */
    public VaultHandle open(char[] passphrase) {
        if (!exists()) {
            throw NotFoundException.vault();
        }
        byte[] data = readFile();
        SecretBytes key = null;
        byte[] plaintext = null;
        try {
            VaultContainer.Parsed parsed = VaultContainer.parse(VaultContainer.VAULT_MAGIC, data, MIN_ITERATIONS);
            key = keyDerivation.derive(passphrase, parsed.header().salt(), parsed.header().kdfIterations());
            plaintext = cipherCodec.open(key, parsed.sealed(), parsed.headerBytes());
            VaultPayload payload = mapper.readValue(plaintext, VaultPayload.class);
            return new VaultHandle(this, key, parsed.header().salt(), parsed.header().kdfIterations(), payload);
        } catch (IntegrityException | IOException e) {
            if (key != null) {
                key.close();
            }
            log.debug("Vault open rejected: {}", e.getMessage());
            throw new AuthenticationException();
        } finally {
            if (plaintext != null) {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
    }

    /**
     * Recovery path: validates the container structure without a passphrase.
     *
     * @throws IntegrityException with the specific structural defect
     */
    public VaultHeader checkIntegrity() {
        if (!exists()) {
            throw NotFoundException.vault();
        }
        return VaultContainer.parse(VaultContainer.VAULT_MAGIC, readFile(), MIN_ITERATIONS).header();
    }

    /** Seals {@code records} under a key derived from {@code exportPassphrase} and a fresh salt. */
    byte[] sealBundle(List<CredentialRecord> records, char[] exportPassphrase) {
        requireStrongPassphrase(exportPassphrase);
        byte[] salt = keyDerivation.newSalt();
        VaultHeader header = new VaultHeader(VaultContainer.FORMAT_VERSION, salt, kdfIterations);
        byte[] headerBytes = VaultContainer.header(VaultContainer.EXPORT_MAGIC, header);
        byte[] plaintext = null;
        try (SecretBytes key = keyDerivation.derive(exportPassphrase, salt, kdfIterations)) {
            plaintext = mapper.writeValueAsBytes(
                    new ExportPayload(VaultContainer.FORMAT_VERSION, clock.instant(), records));
            return VaultContainer.join(headerBytes, cipherCodec.seal(key, plaintext, headerBytes));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize export bundle", e);
        } finally {
            if (plaintext != null) {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
    }

    /**
     * Decodes an export bundle completely, or not at all.
     *
     * @throws IntegrityException on a wrong passphrase, tampering or a malformed bundle
     */
    List<CredentialRecord> openBundle(byte[] blob, char[] exportPassphrase) {
        VaultContainer.Parsed parsed = VaultContainer.parse(VaultContainer.EXPORT_MAGIC, blob, MIN_ITERATIONS);
        byte[] plaintext = null;
        try (SecretBytes key = keyDerivation.derive(exportPassphrase, parsed.header().salt(),
                parsed.header().kdfIterations())) {
            plaintext = cipherCodec.open(key, parsed.sealed(), parsed.headerBytes());
            ExportPayload payload = mapper.readValue(plaintext, ExportPayload.class);
            for (CredentialRecord record : payload.records()) {
                if (record.id() == null || record.serviceName() == null) {
                    throw new IntegrityException("export bundle contains an incomplete record");
                }
            }
            return payload.records();
        } catch (IOException e) {
            throw new IntegrityException("export bundle payload is unreadable", e);
        } finally {
            if (plaintext != null) {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
    }

    /** Atomically replaces the vault file with {@code payload} sealed under {@code key}. */
    void write(SecretBytes key, byte[] salt, int iterations, VaultPayload payload) {
        byte[] headerBytes = VaultContainer.header(VaultContainer.VAULT_MAGIC,
                new VaultHeader(VaultContainer.FORMAT_VERSION, salt, iterations));
        byte[] plaintext = null;
        try {
            plaintext = mapper.writeValueAsBytes(payload);
            byte[] content = VaultContainer.join(headerBytes, cipherCodec.seal(key, plaintext, headerBytes));
            replaceAtomically(content);
            log.debug("Wrote vault {} ({} records, {} bytes)", path, payload.records().size(), content.length);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write vault " + path, e);
        } finally {
            if (plaintext != null) {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
    }

    int kdfIterations() {
        return kdfIterations;
    }

    KeyDerivation keyDerivation() {
        return keyDerivation;
    }

    AuditLog auditLog() {
        return auditLog;
    }

    static void requireStrongPassphrase(char[] passphrase) {
        if (passphrase == null || passphrase.length < MIN_PASSPHRASE_LENGTH) {
            throw new IllegalArgumentException("passphrase must be at least " + MIN_PASSPHRASE_LENGTH + " characters");
        }
    }

    private void replaceAtomically(byte[] content) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic rename not supported for {}, falling back to plain replace", path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private byte[] readFile() {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read vault " + path, e);
        }
    }

    Instant now() {
        return clock.instant();
    }
}
