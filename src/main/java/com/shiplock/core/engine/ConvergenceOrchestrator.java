package com.shiplock.core.engine;

import com.shiplock.core.events.EventBus;
import com.shiplock.core.events.ShiplockEvent;
import com.shiplock.core.failure.ConvergenceAbortedException;
import com.shiplock.core.failure.ConvergenceException;
import com.shiplock.core.logging.MdcContext;
import com.shiplock.core.metrics.ShiplockMetrics;
import com.shiplock.core.model.BuildHandle;
import com.shiplock.core.model.ConvergenceReport;
import com.shiplock.core.model.Revision;
import com.shiplock.core.model.RunState;
import com.shiplock.core.phase.BuildPhaseController;
import com.shiplock.core.phase.DeployPhaseController;
import com.shiplock.core.poll.CancellationToken;
import com.shiplock.core.poll.PollClock;
import com.shiplock.source.RevisionPublisher;
import com.shiplock.source.RevisionResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Drives one revision through resolve, publish, build and deploy until it is live.
 *
 * <p>Phases run strictly in order and the first fatal condition ends the run.
 * Phase failures never escape as exceptions: they are turned into a
 * {@link ConvergenceReport} whose terminal state selects the exit code.
 * The orchestrator keeps no state between runs, so re-running for a revision
 * that is already live simply converges again.
 */
@Service
public class ConvergenceOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceOrchestrator.class);

    private final RevisionResolver revisionResolver;
    private final RevisionPublisher revisionPublisher;
    private final BuildPhaseController buildPhase;
    private final DeployPhaseController deployPhase;
    private final PollClock clock;
    private final EventBus eventBus;
    private final ShiplockMetrics metrics;

    public ConvergenceOrchestrator(RevisionResolver revisionResolver,
                                   RevisionPublisher revisionPublisher,
                                   BuildPhaseController buildPhase,
                                   DeployPhaseController deployPhase,
                                   PollClock clock,
                                   EventBus eventBus,
                                   ShiplockMetrics metrics) {
        this.revisionResolver = revisionResolver;
        this.revisionPublisher = revisionPublisher;
        this.buildPhase = buildPhase;
        this.deployPhase = deployPhase;
        this.clock = clock;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /** Generates a run id, e.g. {@code SHIP-3f9a1c2e}. */
    public static String newRunId() {
        return "SHIP-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public ConvergenceReport converge(ConvergenceRequest request) {
        return converge(newRunId(), request);
    }

    /**
     * Runs all phases for {@code request} under the given run id.
     * Attach a listener to {@link EventBus} under the same id beforehand to observe progress.
     */
    public ConvergenceReport converge(String runId, ConvergenceRequest request) {
        var start = clock.now();
        var machine = new RunStateMachine(runId);
        var token = request.token();

        Revision revision = null;
        BuildHandle handle = null;
        String message;

        MdcContext.setRun(runId);
        try {
            checkCancelled(token, "resolution");
            revision = resolve(request);
            MdcContext.setRevision(runId, revision.value());
            log.info("Run {} targeting revision {}", runId, revision);
            publish(runId, "run.started", "source", Map.of("revision", revision.value()));

            machine.transition(RunState.PUBLISHING);
            checkCancelled(token, "publish");
            if (request.publish()) {
                revisionPublisher.publish(revision);
                publish(runId, "source.published", "source", Map.of("revision", revision.value()));
            } else {
                log.info("Publishing skipped for {}", revision);
            }

            machine.transition(RunState.BUILDING);
            checkCancelled(token, "build");
            handle = buildPhase.submit(runId, revision);
            buildPhase.awaitSuccess(runId, handle, request.buildConfig(), token);
            machine.transition(RunState.BUILD_OK);

            checkCancelled(token, "deploy");
            machine.transition(RunState.DEPLOYING);
            deployPhase.run(runId, revision, request.deployConfig(), token);
            machine.transition(RunState.CONVERGED);

            message = "converged: deployed=" + revision;
        } catch (ConvergenceException e) {
            machine.transition(e.terminalState());
            message = e.getMessage();
        } finally {
            MdcContext.clear();
        }

        var finalState = machine.current();
        var elapsed = Duration.between(start, clock.now());
        metrics.recordRunResult(finalState.name());

        var payload = new HashMap<String, Object>();
        payload.put("state", finalState.name());
        payload.put("message", message);
        payload.put("elapsedSeconds", elapsed.toSeconds());
        if (finalState.isSuccess()) {
            log.info("Run {} {} after {}s", runId, message, elapsed.toSeconds());
            publish(runId, "run.converged", "deploy", payload);
        } else {
            log.error("Run {} ended in {}: {}", runId, finalState, message);
            publish(runId, "run.failed", phaseOf(finalState), payload);
        }

        return new ConvergenceReport(runId, revision, finalState, handle, message, elapsed);
    }

    private Revision resolve(ConvergenceRequest request) {
        if (request.hasExplicitRevision()) {
            return Revision.of(request.explicitRevision());
        }
        return revisionResolver.resolve();
    }

    private static void checkCancelled(CancellationToken token, String phase) {
        if (token.isCancelled()) {
            throw new ConvergenceAbortedException(phase);
        }
    }

    private static String phaseOf(RunState state) {
        return switch (state) {
            case RESOLUTION_FAILED, PUBLISH_FAILED -> "source";
            case SUBMISSION_FAILED, BUILD_FAILED, BUILD_TIMEOUT -> "build";
            case DEPLOY_REQUEST_FAILED, DEPLOY_TIMEOUT -> "deploy";
            default -> "run";
        };
    }

    private void publish(String runId, String type, String phase, Map<String, Object> payload) {
        eventBus.publish(ShiplockEvent.of(type, runId, phase, payload));
    }
}
