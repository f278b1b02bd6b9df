package de.bsommerfeld.unitupdate.core.domain;

import java.time.Instant;

/**
 * Persisted throttle for update checks.
 *
 * @param lastKnownCount update count from the last negotiation, 0 if none pending
 * @param retryAfter     earliest time the next unforced negotiation may run,
 *                       {@code null} if never negotiated
 */
public record RetryState(int lastKnownCount, Instant retryAfter) {

    /** Whether the retry window is still open at {@code now}. */
    public boolean isWaiting(Instant now) {
        return retryAfter != null && retryAfter.isAfter(now);
    }
}
