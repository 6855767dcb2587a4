package com.shiplock.core.model;

import java.time.Duration;

/**
 * Cadence and bound for one polling phase.
 *
 * @param interval     wait between consecutive evaluations
 * @param timeout      total time budget for the phase, measured from its start
 * @param initialDelay wait before the first evaluation (counts against the timeout)
 */
public record PollConfig(Duration interval, Duration timeout, Duration initialDelay) {

    public PollConfig {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("poll interval must be positive: " + interval);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("poll timeout must be positive: " + timeout);
        }
        if (interval.compareTo(timeout) >= 0) {
            throw new IllegalArgumentException(
                    "poll interval %s must be smaller than timeout %s".formatted(interval, timeout));
        }
        initialDelay = initialDelay == null ? Duration.ZERO : initialDelay;
        if (initialDelay.isNegative() || initialDelay.compareTo(timeout) >= 0) {
            throw new IllegalArgumentException(
                    "initial delay %s must be in [0, %s)".formatted(initialDelay, timeout));
        }
    }

    public static PollConfig of(Duration interval, Duration timeout) {
        return new PollConfig(interval, timeout, Duration.ZERO);
    }

    public static PollConfig ofSeconds(long intervalSeconds, long timeoutSeconds) {
        return of(Duration.ofSeconds(intervalSeconds), Duration.ofSeconds(timeoutSeconds));
    }

    /** Same cadence, waiting one interval before the first evaluation. */
    public PollConfig withSettleDelay() {
        return new PollConfig(interval, timeout, interval);
    }
}
