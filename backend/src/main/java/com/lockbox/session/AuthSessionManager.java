package com.lockbox.session;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lockbox.audit.AuditEventKind;
import com.lockbox.audit.AuditLog;
import com.lockbox.error.AuthenticationException;
import com.lockbox.error.LockoutException;
import com.lockbox.error.SessionExpiredException;
import com.lockbox.vault.VaultHandle;
import com.lockbox.vault.VaultStore;

/**
 * Owns the unlock / lockout state machine and the live sessions.
 *
 * <p>State is per vault identity and held by this instance, not by a static
 * singleton. Authentication attempts on the same vault are serialized. A locked
 * vault is rejected before any key derivation happens. At most one session is
 * live per vault: a new successful unlock ends the previous one.
 *
 * <p>Expiry is evaluated lazily on access; {@link #expireIdleSessions()} can be
 * driven by a timer to zero abandoned keys sooner.
 */
public class AuthSessionManager {

    private static final Logger log = LoggerFactory.getLogger(AuthSessionManager.class);
    private static final int SESSION_ID_BYTES = 32;

    private final SessionProps props;
    private final AuditLog auditLog;
    private final Clock clock;
    private final SecureRandom random;

    private final Map<String, LockoutState> lockouts = new ConcurrentHashMap<>();
    private final Map<String, AuthSession> sessionsById = new ConcurrentHashMap<>();
    private final Map<String, AuthSession> sessionsByVault = new ConcurrentHashMap<>();

    public AuthSessionManager(SessionProps props, AuditLog auditLog, Clock clock) {
        this(props, auditLog, clock, new SecureRandom());
    }

    public AuthSessionManager(SessionProps props, AuditLog auditLog, Clock clock, SecureRandom random) {
        this.props = props;
        this.auditLog = auditLog;
        this.clock = clock;
        this.random = random;
    }

    /**
     * @throws LockoutException if the vault is locked out; no derivation is attempted
     * @throws AuthenticationException on a wrong passphrase or unreadable vault
     */
    public AuthSession authenticate(VaultStore store, char[] passphrase) {
        String identity = store.identity();
        LockoutState lockout = lockouts.computeIfAbsent(identity, k -> new LockoutState());

        synchronized (lockout) {
            Instant now = clock.instant();
            if (lockout.isLocked(now)) {
                auditLog.append(AuditEventKind.AUTH_LOCKED_OUT, null);
                log.warn("Rejected unlock of {}: locked out until {}", identity, lockout.lockedUntil());
                throw new LockoutException(lockout.lockedUntil());
            }

            VaultHandle handle;
            try {
                handle = store.open(passphrase);
            } catch (AuthenticationException e) {
                boolean lockedNow = lockout.recordFailure(clock.instant(), props.maxFailedAttempts(),
                        props.failureWindow(), props.lockoutDuration());
                auditLog.append(AuditEventKind.AUTH_FAILURE, null);
                if (lockedNow) {
                    log.warn("Vault {} locked out until {} after {} failed attempts",
                            identity, lockout.lockedUntil(), lockout.failedAttemptCount());
                } else {
                    log.warn("Failed unlock attempt {} of {} for {}",
                            lockout.failedAttemptCount(), props.maxFailedAttempts(), identity);
                }
                throw e;
            }

            lockout.reset();
            AuthSession previous = sessionsByVault.remove(identity);
            if (previous != null) {
                end(previous);
                log.info("Replaced existing session for {}", identity);
            }

            AuthSession session = new AuthSession(newSessionId(), identity, handle, clock.instant());
            sessionsById.put(session.sessionId(), session);
            sessionsByVault.put(identity, session);
            auditLog.append(AuditEventKind.AUTH_SUCCESS, session.sessionId());
            log.info("Vault {} unlocked", identity);
            return session;
        }
    }

    /**
     * Resolves a live session and records activity on it.
     *
     * @throws SessionExpiredException for unknown, ended or idle-expired sessions
     */
    public AuthSession require(String sessionId) {
        AuthSession session = sessionId == null ? null : sessionsById.get(sessionId);
        if (session == null || session.isEnded()) {
            throw new SessionExpiredException();
        }
        if (isExpired(session)) {
            expire(session);
            throw new SessionExpiredException();
        }
        touch(session);
        return session;
    }

    public void touch(AuthSession session) {
        session.touch(clock.instant());
    }

    public boolean isExpired(AuthSession session) {
        return Duration.between(session.lastActivityAt(), clock.instant()).compareTo(props.timeout()) > 0;
    }

    /** Ends the session and zeroes its key now. Unknown ids are ignored. */
    public void logout(String sessionId) {
        AuthSession session = sessionId == null ? null : sessionsById.get(sessionId);
        if (session == null || !end(session)) {
            return;
        }
        auditLog.append(AuditEventKind.LOGOUT, session.sessionId());
        log.info("Session ended for {}", session.vaultIdentity());
    }

    /** Non-touching lookup for status queries. */
    public Optional<AuthSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        AuthSession session = sessionsById.get(sessionId);
        if (session == null || session.isEnded() || isExpired(session)) {
            return Optional.empty();
        }
        return Optional.of(session);
    }

    public Optional<Instant> lockedUntil(VaultStore store) {
        LockoutState lockout = lockouts.get(store.identity());
        if (lockout == null) {
            return Optional.empty();
        }
        synchronized (lockout) {
            return lockout.isLocked(clock.instant()) ? Optional.of(lockout.lockedUntil()) : Optional.empty();
        }
    }

    /** @return number of sessions ended */
    public int expireIdleSessions() {
        List<AuthSession> idle = new ArrayList<>();
        for (AuthSession session : sessionsById.values()) {
            if (isExpired(session)) {
                idle.add(session);
            }
        }
        idle.forEach(this::expire);
        return idle.size();
    }

    /** Ends every session, e.g. on shutdown. */
    public void endAll() {
        new ArrayList<>(sessionsById.values()).forEach(this::end);
    }

    public int activeSessionCount() {
        return sessionsById.size();
    }

    private void expire(AuthSession session) {
        if (end(session)) {
            auditLog.append(AuditEventKind.SESSION_EXPIRED, session.sessionId());
            log.info("Session for {} expired after inactivity", session.vaultIdentity());
        }
    }

    /** @return false if another caller already ended it */
    private boolean end(AuthSession session) {
        boolean removed = sessionsById.remove(session.sessionId(), session);
        sessionsByVault.remove(session.vaultIdentity(), session);
        session.end();
        return removed;
    }

    private String newSessionId() {
        byte[] bytes = new byte[SESSION_ID_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
