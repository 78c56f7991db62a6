package com.lockbox.audit;

import java.time.Instant;

/**
 * One link of the audit chain. {@code entryHash} covers {@code priorEntryHash}
 * and every other field, so editing, dropping or reordering entries is detectable.
 */
public record AuditLogEntry(
        long sequenceNumber,
        Instant timestamp,
        AuditEventKind eventKind,
        String subjectId,         // credential id, session id, token id; null for vault-wide events
        String priorEntryHash,
        String entryHash
) {}
