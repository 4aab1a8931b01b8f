package com.warehouse.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-call execution context: the instant after which store calls made on
 * behalf of a request must be abandoned.
 */
public record Deadline(Instant expiresAt, Clock clock) {

    public static Deadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static Deadline after(Duration timeout, Clock clock) {
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * Remaining time rounded up to whole seconds, the granularity of JDBC and
     * transaction timeouts. Zero once expired.
     */
    public int remainingSeconds() {
        if (isExpired()) {
            return 0;
        }
        long millis = remaining().toMillis();
        long seconds = (millis + 999) / 1000;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, seconds));
    }
}
