package com.shiplock.core.poll;

import com.shiplock.core.model.PollConfig;
import com.shiplock.remote.RemoteControlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Consumer;

/**
 * Bounded wait shared by every polling phase.
 *
 * <p>Evaluates a {@link PollCondition} at a fixed cadence until it reports
 * success or failure, the phase timeout elapses, or the run is cancelled.
 * The timeout is checked before each evaluation, so no evaluation starts at
 * or after the deadline, and the last sleep is cut short to end exactly at it.
 *
 * <p>A {@link RemoteControlException} thrown by the condition counts as a
 * non-terminal tick, whether transient or rejected: a control plane that stays
 * broken still exhausts the timeout. Any other exception propagates.
 */
public class PollUntil {

    private static final Logger log = LoggerFactory.getLogger(PollUntil.class);

    private final PollClock clock;

    public PollUntil(PollClock clock) {
        this.clock = clock;
    }

    public <T> PollResult<T> run(String phase, PollConfig config, CancellationToken token,
                                 PollCondition<T> condition) {
        return run(phase, config, token, condition, tick -> { });
    }

    /**
     * Runs the loop.
     *
     * @param phase     phase name used in progress lines
     * @param config    cadence, timeout and initial delay
     * @param token     caller cancellation signal
     * @param condition evaluated once per tick
     * @param onTick    notified after every non-terminal tick
     */
    public <T> PollResult<T> run(String phase, PollConfig config, CancellationToken token,
                                 PollCondition<T> condition, Consumer<PollTick> onTick) {
        Instant start = clock.now();
        int attempts = 0;
        String lastDetail = "";

        try {
            if (!config.initialDelay().isZero()) {
                log.debug("[{}] waiting {}s before first poll", phase, config.initialDelay().toSeconds());
                clock.sleep(config.initialDelay(), token);
            }

            while (true) {
                if (token.isCancelled()) {
                    log.warn("[{}] cancelled after {} attempt(s)", phase, attempts);
                    return new PollResult<>(PollResult.Status.CANCELLED, null, lastDetail, attempts, elapsedSince(start));
                }

                Duration elapsed = elapsedSince(start);
                if (elapsed.compareTo(config.timeout()) >= 0) {
                    log.warn("[{}] timed out after {}s ({} attempts, last={})",
                            phase, elapsed.toSeconds(), attempts, display(lastDetail));
                    return new PollResult<>(PollResult.Status.TIMED_OUT, null, lastDetail, attempts, elapsed);
                }

                attempts++;
                boolean transientFailure = false;
                try {
                    PollDecision<T> decision = condition.evaluate();
                    switch (decision.kind()) {
                        case SUCCESS -> {
                            return new PollResult<>(PollResult.Status.SUCCEEDED, decision.value(),
                                    decision.detail(), attempts, elapsed);
                        }
                        case FAILURE -> {
                            return new PollResult<>(PollResult.Status.FAILED, null,
                                    decision.detail(), attempts, elapsed);
                        }
                        case PENDING -> lastDetail = decision.detail() != null ? decision.detail() : "";
                    }
                } catch (RemoteControlException e) {
                    transientFailure = true;
                    log.warn("[{}] attempt={} elapsed={}s remote call failed ({}), retrying: {}",
                            phase, attempts, elapsed.toSeconds(),
                            e.isTransient() ? "transient" : "rejected", e.getMessage());
                }

                if (!transientFailure) {
                    log.info("[{}] attempt={} elapsed={}s status={}",
                            phase, attempts, elapsed.toSeconds(), display(lastDetail));
                }
                onTick.accept(new PollTick(phase, attempts, elapsed, lastDetail, transientFailure));

                Duration remaining = config.timeout().minus(elapsedSince(start));
                if (!remaining.isNegative() && !remaining.isZero()) {
                    clock.sleep(remaining.compareTo(config.interval()) < 0 ? remaining : config.interval(), token);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] interrupted while polling", phase);
            return new PollResult<>(PollResult.Status.CANCELLED, null, lastDetail, attempts, elapsedSince(start));
        }
    }

    private Duration elapsedSince(Instant start) {
        return Duration.between(start, clock.now());
    }

    private static String display(String detail) {
        return detail == null || detail.isEmpty() ? "PENDING" : detail;
    }
}
