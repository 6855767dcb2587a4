package com.shiplock.core.phase;

import com.shiplock.core.events.EventBus;
import com.shiplock.core.events.ShiplockEvent;
import com.shiplock.core.failure.ConvergenceAbortedException;
import com.shiplock.core.failure.DeployTimeoutException;
import com.shiplock.core.failure.DeploymentRequestException;
import com.shiplock.core.logging.MdcContext;
import com.shiplock.core.metrics.ShiplockMetrics;
import com.shiplock.core.model.DeploymentState;
import com.shiplock.core.model.PollConfig;
import com.shiplock.core.model.Revision;
import com.shiplock.core.poll.CancellationToken;
import com.shiplock.core.poll.PollClock;
import com.shiplock.core.poll.PollDecision;
import com.shiplock.core.poll.PollResult;
import com.shiplock.core.poll.PollTick;
import com.shiplock.core.poll.PollUntil;
import com.shiplock.remote.RemoteControlClient;
import com.shiplock.remote.RemoteControlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Requests deployment of a revision and polls until it is the live one.
 *
 * <p>The control plane does not report deploy failures, so this phase only
 * ever converges or times out.
 */
@Component
public class DeployPhaseController {

    private static final Logger log = LoggerFactory.getLogger(DeployPhaseController.class);

    static final String PHASE = "deploy";

    private final RemoteControlClient client;
    private final PollUntil pollUntil;
    private final EventBus eventBus;
    private final ShiplockMetrics metrics;

    public DeployPhaseController(RemoteControlClient client, PollClock clock, EventBus eventBus,
                                 ShiplockMetrics metrics) {
        this.client = client;
        this.pollUntil = new PollUntil(clock);
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs the deploy phase to convergence.
     *
     * @return the converged deployment state
     * @throws DeploymentRequestException  if the control plane did not accept the request
     * @throws DeployTimeoutException      if the live revision never matched within {@code config.timeout()}
     * @throws ConvergenceAbortedException if {@code token} was cancelled
     */
    public DeploymentState run(String runId, Revision revision, PollConfig config, CancellationToken token) {
        MdcContext.setPhase(PHASE);

        try {
            client.requestDeployment(revision);
        } catch (RemoteControlException e) {
            log.error("[deploy] request for {} failed: {}", revision, e.getMessage());
            throw new DeploymentRequestException(e.getMessage(), e);
        }
        log.info("[deploy] requested revision={}", revision);
        publish(runId, "deploy.requested", Map.of("revision", revision.value()));

        var lastObserved = new AtomicReference<>("");
        PollResult<DeploymentState> result = pollUntil.run(PHASE, config, token,
                () -> {
                    var state = new DeploymentState(revision, client.getDeployedRevision());
                    lastObserved.set(state.observedDeployedRevision());
                    var detail = "deployed=" + display(state.observedDeployedRevision());
                    return state.isConverged()
                            ? PollDecision.success(state, detail)
                            : PollDecision.pending(detail);
                },
                tick -> onTick(runId, tick));

        metrics.recordPollAttempts(PHASE, result.attempts());
        metrics.recordPhaseDuration(PHASE, result.status().name(), result.elapsed());

        return switch (result.status()) {
            case SUCCEEDED -> {
                log.info("[deploy] converged revision={} elapsed={}s", revision, result.elapsed().toSeconds());
                publish(runId, "deploy.converged", Map.of("revision", revision.value(),
                        "elapsedSeconds", result.elapsed().toSeconds()));
                yield result.value();
            }
            case TIMED_OUT -> {
                log.error("[deploy] timeout: deployed={} expected={}", display(lastObserved.get()), revision);
                throw new DeployTimeoutException(result.elapsed(), display(lastObserved.get()), revision.value());
            }
            case CANCELLED -> throw new ConvergenceAbortedException(PHASE);
            case FAILED -> throw new IllegalStateException("deploy phase has no failure outcome");
        };
    }

    private void onTick(String runId, PollTick tick) {
        if (tick.transientFailure()) {
            metrics.incrementTransientFailures(PHASE);
        }
        publish(runId, "deploy.progress", Map.of(
                "attempt", tick.attempt(),
                "elapsedSeconds", tick.elapsed().toSeconds(),
                "status", tick.detail(),
                "transientFailure", tick.transientFailure()));
    }

    private void publish(String runId, String type, Map<String, Object> payload) {
        eventBus.publish(ShiplockEvent.of(type, runId, PHASE, payload));
    }

    private static String display(String revision) {
        return revision == null || revision.isEmpty() ? "<none>" : revision;
    }
}
