package com.shiplock.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for convergence runs.
 */
@Service
public class ShiplockMetrics {

    private final MeterRegistry registry;

    public ShiplockMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPhaseDuration(String phase, String result, Duration elapsed) {
        Timer.builder("shiplock.phase.duration")
                .tag("phase", phase)
                .tag("result", result)
                .register(registry)
                .record(elapsed);
    }

    /**
     * Records how many poll attempts a phase needed before it ended.
     *
     * @param phase    "build" or "deploy"
     * @param attempts number of condition evaluations
     */
    public void recordPollAttempts(String phase, int attempts) {
        DistributionSummary.builder("shiplock.poll.attempts")
                .description("Poll attempts per phase")
                .tag("phase", phase)
                .register(registry)
                .record(attempts);
    }

    public void incrementTransientFailures(String phase) {
        Counter.builder("shiplock.poll.transient_failures")
                .description("Remote calls that failed inside a poll loop and were retried")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordRunResult(String finalState) {
        Counter.builder("shiplock.runs.total")
                .tag("state", finalState)
                .register(registry)
                .increment();
    }
}
