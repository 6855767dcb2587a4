package com.shiplock.core.poll;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Caller-owned abort signal for a convergence run.
 * <p>
 * Thread-safe: typically cancelled from a shutdown hook or a supervising
 * thread while the run thread is blocked in {@link #await(Duration)}.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Blocks for up to {@code duration}, returning early if cancelled.
     *
     * @return {@code true} if the token was cancelled before or during the wait
     */
    public boolean await(Duration duration) throws InterruptedException {
        return cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }
}
