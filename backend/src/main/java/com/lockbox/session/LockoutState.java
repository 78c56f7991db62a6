package com.lockbox.session;

import java.time.Duration;
import java.time.Instant;

/**
 * Failed-attempt bookkeeping for one vault. Guarded by the owning manager.
 */
final class LockoutState {

    private int failedAttemptCount;
    private Instant firstFailureAt;
    private Instant lockedUntil;

    /** True while locked; clears itself once the lockout has run out. */
    boolean isLocked(Instant now) {
        if (lockedUntil == null) {
            return false;
        }
        if (now.isBefore(lockedUntil)) {
            return true;
        }
        reset();
        return false;
    }

    /**
     * Counts a failure. Failures older than {@code window} are forgotten first.
     *
     * @return true if this failure started a lockout
     */
    boolean recordFailure(Instant now, int maxAttempts, Duration window, Duration lockoutDuration) {
        if (firstFailureAt != null && Duration.between(firstFailureAt, now).compareTo(window) > 0) {
            failedAttemptCount = 0;
            firstFailureAt = null;
        }
        if (failedAttemptCount == 0) {
            firstFailureAt = now;
        }
        failedAttemptCount++;
        if (failedAttemptCount >= maxAttempts) {
            lockedUntil = now.plus(lockoutDuration);
            return true;
        }
        return false;
    }

    void reset() {
        failedAttemptCount = 0;
        firstFailureAt = null;
        lockedUntil = null;
    }

    int failedAttemptCount() {
        return failedAttemptCount;
    }

    Instant lockedUntil() {
        return lockedUntil;
    }
}
