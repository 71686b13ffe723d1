package com.platform.gitops.apply;

import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * The single budget of one attempt, shared by every phase from render to health assessment.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;
    private final Duration timeout;

    private Deadline(Clock clock, Duration timeout) {
        this.clock = clock;
        this.timeout = timeout;
        this.expiresAt = clock.instant().plus(timeout);
    }

    public static Deadline after(Duration timeout, Clock clock) {
        return new Deadline(clock, timeout);
    }

    public Duration timeout() {
        return timeout;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Fails the phase when the budget is spent or the attempt thread was interrupted.
     *
     * @throws ReconciliationTimeoutException carrying the phase's error code
     */
    public void check(ErrorCode phase, String detail) {
        if (Thread.currentThread().isInterrupted() || isExpired()) {
            throw new ReconciliationTimeoutException(phase, timeout, detail);
        }
    }
}
