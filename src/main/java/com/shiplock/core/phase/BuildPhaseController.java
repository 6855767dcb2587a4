package com.shiplock.core.phase;

import com.shiplock.core.ShiplockProperties;
import com.shiplock.core.events.EventBus;
import com.shiplock.core.events.ShiplockEvent;
import com.shiplock.core.failure.BuildFailedException;
import com.shiplock.core.failure.BuildTimeoutException;
import com.shiplock.core.failure.ConvergenceAbortedException;
import com.shiplock.core.failure.SubmissionException;
import com.shiplock.core.logging.MdcContext;
import com.shiplock.core.metrics.ShiplockMetrics;
import com.shiplock.core.model.BuildHandle;
import com.shiplock.core.model.PollConfig;
import com.shiplock.core.model.Revision;
import com.shiplock.core.poll.CancellationToken;
import com.shiplock.core.poll.PollClock;
import com.shiplock.core.poll.PollDecision;
import com.shiplock.core.poll.PollResult;
import com.shiplock.core.poll.PollTick;
import com.shiplock.core.poll.PollUntil;
import com.shiplock.core.status.StatusClassifier;
import com.shiplock.core.status.StatusContractViolationException;
import com.shiplock.remote.RemoteControlClient;
import com.shiplock.remote.RemoteControlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Submits a build for a revision and polls the build listing until it ends.
 *
 * <p>Submission and waiting are separate steps so the caller holds the handle
 * even when the wait fails. The submission is never retried. The poll condition
 * looks the build up by handle on every tick; a build that is not listed yet
 * counts as pending.
 */
@Component
public class BuildPhaseController {

    private static final Logger log = LoggerFactory.getLogger(BuildPhaseController.class);

    static final String PHASE = "build";

    private final RemoteControlClient client;
    private final PollUntil pollUntil;
    private final EventBus eventBus;
    private final ShiplockMetrics metrics;
    private final int buildListLimit;

    public BuildPhaseController(RemoteControlClient client, PollClock clock, EventBus eventBus,
                                ShiplockMetrics metrics, ShiplockProperties properties) {
        this.client = client;
        this.pollUntil = new PollUntil(clock);
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.buildListLimit = properties.getBuildListLimit();
    }

    /**
     * Submits a build of {@code revision}. Called exactly once per run.
     *
     * @return the handle the control plane assigned to the build
     * @throws SubmissionException if the control plane did not accept the build
     */
    public BuildHandle submit(String runId, Revision revision) {
        MdcContext.setPhase(PHASE);

        BuildHandle handle;
        try {
            handle = client.submitBuild(revision);
        } catch (RemoteControlException e) {
            log.error("[build] submission for {} failed: {}", revision, e.getMessage());
            throw new SubmissionException(e.getMessage(), e);
        }
        log.info("[build] submitted handle={} revision={}", handle, revision);
        publish(runId, "build.submitted", Map.of("handle", handle.id(), "revision", revision.value()));
        return handle;
    }

    /**
     * Polls the build listing until the submitted build ends.
     *
     * @return {@code handle}, once the build succeeded
     * @throws BuildFailedException        if the build failed or was cancelled
     * @throws BuildTimeoutException       if the build did not finish within {@code config.timeout()}
     * @throws ConvergenceAbortedException if {@code token} was cancelled
     */
    public BuildHandle awaitSuccess(String runId, BuildHandle handle, PollConfig config, CancellationToken token) {
        MdcContext.setPhase(PHASE);

        var classifier = new StatusClassifier();
        PollResult<BuildHandle> result;
        try {
            result = pollUntil.run(PHASE, config, token,
                    () -> observe(handle, classifier),
                    tick -> onTick(runId, handle, tick));
        } catch (StatusContractViolationException e) {
            log.error("[build] {}", e.getMessage());
            throw new BuildFailedException(handle, "CONTRACT_VIOLATION", e);
        }

        metrics.recordPollAttempts(PHASE, result.attempts());
        metrics.recordPhaseDuration(PHASE, result.status().name(), result.elapsed());

        return switch (result.status()) {
            case SUCCEEDED -> {
                log.info("[build] success handle={} elapsed={}s", handle, result.elapsed().toSeconds());
                publish(runId, "build.succeeded", Map.of("handle", handle.id(),
                        "elapsedSeconds", result.elapsed().toSeconds()));
                yield handle;
            }
            case FAILED -> {
                log.error("[build] status={} handle={}", result.detail(), handle);
                throw new BuildFailedException(handle, result.detail());
            }
            case TIMED_OUT -> {
                log.error("[build] timeout after {}s handle={}", result.elapsed().toSeconds(), handle);
                throw new BuildTimeoutException(handle, result.elapsed(), orPending(result.detail()));
            }
            case CANCELLED -> throw new ConvergenceAbortedException(PHASE);
        };
    }

    private PollDecision<BuildHandle> observe(BuildHandle handle, StatusClassifier classifier) {
        var record = client.listRecentBuilds(buildListLimit).stream()
                .filter(r -> r.matches(handle))
                .findFirst();
        var rawStatus = record.map(r -> r.rawStatus()).orElse("");

        return switch (classifier.observe(handle, rawStatus)) {
            case SUCCEEDED -> PollDecision.success(handle, rawStatus);
            case FAILED, CANCELLED -> PollDecision.failure(rawStatus);
            case PENDING, RUNNING, UNKNOWN -> PollDecision.pending(orPending(rawStatus));
        };
    }

    private void onTick(String runId, BuildHandle handle, PollTick tick) {
        if (tick.transientFailure()) {
            metrics.incrementTransientFailures(PHASE);
        }
        publish(runId, "build.progress", Map.of(
                "handle", handle.id(),
                "attempt", tick.attempt(),
                "elapsedSeconds", tick.elapsed().toSeconds(),
                "status", orPending(tick.detail()),
                "transientFailure", tick.transientFailure()));
    }

    private void publish(String runId, String type, Map<String, Object> payload) {
        eventBus.publish(ShiplockEvent.of(type, runId, PHASE, payload));
    }

    private static String orPending(String status) {
        return status == null || status.isBlank() ? "PENDING" : status;
    }
}
