package com.shiplock.core.poll;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock {@link PollClock}. Sleeps wake up immediately on cancellation.
 */
@Component
public class SystemPollClock implements PollClock {

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public void sleep(Duration duration, CancellationToken token) throws InterruptedException {
        token.await(duration);
    }
}
