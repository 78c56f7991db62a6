package com.lockbox.share;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

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
import com.lockbox.error.TokenExpiredException;
import com.lockbox.error.VaultException;
import com.lockbox.vault.CredentialRecord;
import com.lockbox.vault.VaultHandle;

/**
 * Issues and redeems single-use, time-limited grants to one credential.
 *
 * <p>A token string is {@code <token_id>.<token_key>}. The service keeps only the
 * snapshot sealed under {@code token_key}, so its table never holds a readable
 * secret. An optional share passphrase is stored as a salted PBKDF2 hash.
 *
 * <p><strong>Scope boundary:</strong> redemption reads the snapshot frozen at issuance,
 * not the live vault. Redeeming needs no unlocked vault, and editing or deleting
 * the credential afterwards does not invalidate a live token.
 */
public class ShareTokenService {

    private static final Logger log = LoggerFactory.getLogger(ShareTokenService.class);
    private static final int TOKEN_ID_BYTES = 16;
    private static final int TOKEN_KEY_BYTES = 32;
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ShareProps props;
    private final CipherCodec cipherCodec;
    private final KeyDerivation keyDerivation;
    private final AuditLog auditLog;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final SecureRandom random;
    private final Map<String, ShareToken> tokens = new ConcurrentHashMap<>();
    private final Set<String> purgedTokenIds = ConcurrentHashMap.newKeySet();

    public ShareTokenService(ShareProps props,
                             CipherCodec cipherCodec,
                             KeyDerivation keyDerivation,
                             AuditLog auditLog,
                             ObjectMapper mapper,
                             Clock clock) {
        this(props, cipherCodec, keyDerivation, auditLog, mapper, clock, new SecureRandom());
    }

    public ShareTokenService(ShareProps props,
                             CipherCodec cipherCodec,
                             KeyDerivation keyDerivation,
                             AuditLog auditLog,
                             ObjectMapper mapper,
                             Clock clock,
                             SecureRandom random) {
        this.props = props;
        this.cipherCodec = cipherCodec;
        this.keyDerivation = keyDerivation;
        this.auditLog = auditLog;
        this.mapper = mapper;
        this.clock = clock;
        this.random = random;
    }

    /**
     * @param ttl null for the configured default
     * @param sharePassphrase null or empty for an unprotected share
     * @throws NotFoundException if the credential is not in the unlocked vault
     */
    public IssuedShare issue(VaultHandle vault, String credentialId, Duration ttl, char[] sharePassphrase) {
        Duration effectiveTtl = ttl == null ? props.defaultTtl() : ttl;
        if (effectiveTtl.isZero() || effectiveTtl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (effectiveTtl.compareTo(props.maxTtl()) > 0) {
            throw new IllegalArgumentException("ttl exceeds the maximum of " + props.maxTtl());
        }
        purgeStale();

        CredentialRecord record = vault.get(credentialId);
        SharedCredential snapshot = new SharedCredential(
                record.serviceName(), record.username(), record.secret(), record.url(), record.notes());

        String tokenId = randomToken(TOKEN_ID_BYTES);
        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plus(effectiveTtl);

        byte[] salt = null;
        byte[] hash = null;
        if (sharePassphrase != null && sharePassphrase.length > 0) {
            salt = keyDerivation.newSalt();
            try (SecretBytes derived = keyDerivation.derive(sharePassphrase, salt, props.passphraseIterations())) {
                hash = derived.reveal().clone();
            }
        }

        byte[] keyBytes = new byte[TOKEN_KEY_BYTES];
        random.nextBytes(keyBytes);
        String token;
        byte[] plaintext = null;
        try (SecretBytes tokenKey = SecretBytes.wrap(keyBytes)) {
            plaintext = mapper.writeValueAsBytes(snapshot);
            byte[] sealed = cipherCodec.seal(tokenKey, plaintext, tokenId.getBytes(StandardCharsets.US_ASCII));
            token = tokenId + "." + ENCODER.encodeToString(tokenKey.reveal());
            tokens.put(tokenId, new ShareToken(tokenId, credentialId, issuedAt, expiresAt, sealed, salt, hash));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize share snapshot", e);
        } finally {
            if (plaintext != null) {
                Arrays.fill(plaintext, (byte) 0);
            }
        }

        auditLog.append(AuditEventKind.SHARE_ISSUED, credentialId);
        log.info("Issued share {} for credential {} (expires {}, protected={})",
                tokenId, credentialId, expiresAt, hash != null);
        return new IssuedShare(token, tokenId, credentialId, issuedAt, expiresAt, hash != null);
    }

    /**
     * Redeems a token once.
     *
     * @throws NotFoundException for a token that was never issued by this service
     * @throws TokenExpiredException if past expiry, already redeemed, burned or purged
     * @throws AuthenticationException for a missing/wrong share passphrase or a forged token key
     */
    public SharedCredential redeem(String token, char[] sharePassphrase) {
        String tokenId = null;
        try {
            String[] parts = split(token);
            tokenId = parts[0];
            SharedCredential credential = redeem(parts[0], parts[1], sharePassphrase);
            auditLog.append(AuditEventKind.SHARE_REDEEMED, tokenId);
            log.info("Share {} redeemed", tokenId);
            return credential;
        } catch (VaultException e) {
            auditLog.append(AuditEventKind.SHARE_REDEEM_FAILED, tokenId);
            log.warn("Share redemption failed for {}: {}", tokenId, e.code());
            throw e;
        }
    }

    /**
     * Wipes expired snapshots and drops tombstones one default ttl after expiry. Only the
     * id of a dropped token is remembered, so it keeps reporting expiry.
     */
    public int purgeStale() {
        Instant now = clock.instant();
        int removed = 0;
        for (ShareToken share : tokens.values()) {
            synchronized (share) {
                if (share.isExpired(now)) {
                    share.wipe();
                }
                if (now.isAfter(share.expiresAt().plus(props.defaultTtl()))
                        && tokens.remove(share.tokenId(), share)) {
                    purgedTokenIds.add(share.tokenId());
                    removed++;
                }
            }
        }
        return removed;
    }

    public int liveTokenCount() {
        Instant now = clock.instant();
        return (int) tokens.values().stream().filter(share -> !share.isSpent(now)).count();
    }

    private SharedCredential redeem(String tokenId, String encodedKey, char[] sharePassphrase) {
        ShareToken share = tokens.get(tokenId);
        if (share == null) {
            if (purgedTokenIds.contains(tokenId)) {
                throw new TokenExpiredException();
            }
            throw new NotFoundException("Share token not found");
        }
        synchronized (share) {
            Instant now = clock.instant();
            if (share.isSpent(now)) {
                share.wipe();
                throw new TokenExpiredException();
            }

            // the key is authenticated first so only a real token holder can spend passphrase attempts
            byte[] plaintext = openSnapshot(share, encodedKey);
            try {
                if (share.passphraseProtected()) {
                    verifyPassphrase(share, sharePassphrase);
                }
                SharedCredential credential = mapper.readValue(plaintext, SharedCredential.class);
                share.markRedeemed();
                return credential;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read share snapshot", e);
            } finally {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
    }

    private byte[] openSnapshot(ShareToken share, String encodedKey) {
        byte[] keyBytes;
        try {
            keyBytes = DECODER.decode(encodedKey);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException("Invalid share token");
        }
        try (SecretBytes tokenKey = SecretBytes.wrap(keyBytes)) {
            if (tokenKey.length() != TOKEN_KEY_BYTES) {
                throw new AuthenticationException("Invalid share token");
            }
            return cipherCodec.open(tokenKey, share.sealedSnapshot(),
                    share.tokenId().getBytes(StandardCharsets.US_ASCII));
        } catch (IntegrityException e) {
            throw new AuthenticationException("Invalid share token");
        }
    }

    private void verifyPassphrase(ShareToken share, char[] sharePassphrase) {
        boolean matches = false;
        if (sharePassphrase != null && sharePassphrase.length > 0) {
            try (SecretBytes candidate = keyDerivation.derive(sharePassphrase, share.passphraseSalt(),
                    props.passphraseIterations())) {
                matches = org.bouncycastle.util.Arrays.constantTimeAreEqual(candidate.reveal(), share.passphraseHash());
            }
        }
        if (!matches) {
            if (share.recordFailedAttempt() >= props.maxRedeemAttempts()) {
                share.markRedeemed();
                log.warn("Share {} burned after {} wrong passphrases", share.tokenId(), props.maxRedeemAttempts());
            }
            throw new AuthenticationException("Share passphrase required or incorrect");
        }
    }

    private static String[] split(String token) {
        int dot = token == null ? -1 : token.indexOf('.');
        if (dot <= 0 || dot == token.length() - 1) {
            throw new NotFoundException("Share token not found");
        }
        return new String[] {token.substring(0, dot), token.substring(dot + 1)};
    }

    private String randomToken(int bytes) {
        byte[] raw = new byte[bytes];
        random.nextBytes(raw);
        return ENCODER.encodeToString(raw);
    }
}
