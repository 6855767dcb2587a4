package com.shiplock.core.poll;

import java.time.Duration;
import java.time.Instant;

/**
 * Time source and blocking wait used by {@link PollUntil}.
 */
public interface PollClock {

    Instant now();

    /**
     * Waits for {@code duration}, returning early when {@code token} is cancelled.
     */
    void sleep(Duration duration, CancellationToken token) throws InterruptedException;
}
