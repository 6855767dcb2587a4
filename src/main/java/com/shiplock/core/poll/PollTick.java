package com.shiplock.core.poll;

import java.time.Duration;

/**
 * A non-terminal poll attempt, reported once per tick.
 *
 * @param phase            phase name, e.g. "build"
 * @param attempt          1-based attempt number within the phase
 * @param elapsed          time since the phase started
 * @param detail           last observed status or revision
 * @param transientFailure {@code true} if the remote call failed on this tick
 */
public record PollTick(String phase, int attempt, Duration elapsed, String detail, boolean transientFailure) {
}
