package com.lockbox.audit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lockbox.error.TamperDetectedException;

/**
 * Append-only, hash-chained audit trail stored as one JSON object per line.
 *
 * <p>{@code entry_hash = SHA-256(prior_hash | seq | timestamp | kind | subject)}; the first
 * entry chains from {@link #GENESIS_HASH}. Appends are serialized and each line is forced
 * to disk before the call returns. {@link #verifyChain()} re-reads the file, so it also
 * catches edits made behind the process's back.
 *
 * <p>If the file cannot be parsed at startup the instance is poisoned: appends and
 * verification both raise {@link TamperDetectedException} until an operator intervenes.
 */
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    public static final String GENESIS_HASH = "0".repeat(64);

    private final Path path;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final List<AuditLogEntry> entries = new ArrayList<>();
    private TamperDetectedException loadFailure;

    public AuditLog(Path path, ObjectMapper mapper, Clock clock) {
        this.path = path;
        this.mapper = mapper;
        this.clock = clock;
        try {
            entries.addAll(readAll());
        } catch (TamperDetectedException e) {
            log.error("Audit log at {} is unreadable; refusing further appends", path, e);
            loadFailure = e;
        }
    }

    public synchronized AuditLogEntry append(AuditEventKind kind, String subjectId) {
        if (loadFailure != null) {
            throw loadFailure;
        }
        long sequence = entries.isEmpty() ? 1 : entries.get(entries.size() - 1).sequenceNumber() + 1;
        String prior = entries.isEmpty() ? GENESIS_HASH : entries.get(entries.size() - 1).entryHash();
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        AuditLogEntry entry = new AuditLogEntry(sequence, now, kind, subjectId, prior,
                hash(prior, sequence, now, kind, subjectId));
        write(entry);
        entries.add(entry);
        log.debug("Audit #{} {} {}", sequence, kind, subjectId);
        return entry;
    }

    /** The most recent {@code limit} entries in sequence order. */
    public synchronized List<AuditLogEntry> recent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        int from = Math.max(0, entries.size() - limit);
        return List.copyOf(entries.subList(from, entries.size()));
    }

    public synchronized List<AuditLogEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Recomputes the chain from the first persisted entry.
     *
     * @return number of verified entries
     * @throws TamperDetectedException at the first entry that does not link or hash correctly
     */
    public synchronized int verifyChain() {
        if (loadFailure != null) {
            throw loadFailure;
        }
        List<AuditLogEntry> persisted = readAll();
        String expectedPrior = GENESIS_HASH;
        long expectedSequence = 1;
        for (AuditLogEntry entry : persisted) {
            if (entry.timestamp() == null || entry.eventKind() == null
                    || entry.priorEntryHash() == null || entry.entryHash() == null) {
                throw tamper(entry.sequenceNumber(), "entry is missing a required field");
            }
            if (entry.sequenceNumber() != expectedSequence) {
                throw tamper(entry.sequenceNumber(), "expected sequence " + expectedSequence);
            }
            if (!expectedPrior.equals(entry.priorEntryHash())) {
                throw tamper(entry.sequenceNumber(), "prior hash does not match previous entry");
            }
            String recomputed = hash(entry.priorEntryHash(), entry.sequenceNumber(), entry.timestamp(),
                    entry.eventKind(), entry.subjectId());
            if (!recomputed.equals(entry.entryHash())) {
                throw tamper(entry.sequenceNumber(), "entry hash mismatch");
            }
            expectedPrior = entry.entryHash();
            expectedSequence++;
        }
        if (persisted.size() < entries.size()) {
            throw tamper(persisted.size() + 1L, "entries missing from the persisted log");
        }
        return persisted.size();
    }

    static String hash(String prior, long sequence, Instant timestamp, AuditEventKind kind, String subjectId) {
        String canonical = prior + "|" + sequence + "|" + timestamp + "|" + kind.name() + "|"
                + (subjectId == null ? "" : subjectId);
        byte[] input = canonical.getBytes(StandardCharsets.UTF_8);
        SHA256Digest digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Hex.toHexString(out);
    }

    private void write(AuditLogEntry entry) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            byte[] line = (mapper.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
            try (FileChannel channel = FileChannel.open(path,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append audit entry to " + path, e);
        }
    }

    private List<AuditLogEntry> readAll() {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log " + path, e);
        }
        List<AuditLogEntry> parsed = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                parsed.add(mapper.readValue(line, AuditLogEntry.class));
            } catch (JsonProcessingException e) {
                throw tamper(i + 1L, "line " + (i + 1) + " is not a valid entry");
            }
        }
        return parsed;
    }

    private TamperDetectedException tamper(long sequence, String reason) {
        log.warn("Audit chain verification failed at #{}: {}", sequence, reason);
        return new TamperDetectedException(sequence, reason);
    }
}
