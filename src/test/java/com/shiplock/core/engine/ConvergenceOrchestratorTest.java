package com.shiplock.core.engine;

import com.shiplock.core.ShiplockProperties;
import com.shiplock.core.events.EventBus;
import com.shiplock.core.events.ShiplockEvent;
import com.shiplock.core.failure.PublishException;
import com.shiplock.core.failure.ResolutionException;
import com.shiplock.core.metrics.ShiplockMetrics;
import com.shiplock.core.model.BuildHandle;
import com.shiplock.core.model.ConvergenceReport;
import com.shiplock.core.model.PollConfig;
import com.shiplock.core.model.Revision;
import com.shiplock.core.model.RunState;
import com.shiplock.core.phase.BuildPhaseController;
import com.shiplock.core.phase.DeployPhaseController;
import com.shiplock.core.poll.CancellationToken;
import com.shiplock.core.poll.SimulatedClock;
import com.shiplock.remote.RemoteRejectedException;
import com.shiplock.remote.ScriptedRemoteControlClient;
import com.shiplock.remote.northflank.NorthflankApiClient;
import com.shiplock.remote.northflank.NorthflankProperties;
import com.shiplock.source.RevisionPublisher;
import com.shiplock.source.RevisionResolver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the orchestrator against a scripted control plane and a simulated clock.
 */
class ConvergenceOrchestratorTest {

    private static final PollConfig BUILD = PollConfig.ofSeconds(5, 900);
    private static final PollConfig DEPLOY = PollConfig.ofSeconds(5, 600).withSettleDelay();

    private SimulatedClock clock;
    private ScriptedRemoteControlClient client;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private List<Revision> published;
    private RevisionResolver resolver;
    private RevisionPublisher publisher;

    @BeforeEach
    void setUp() {
        clock = new SimulatedClock();
        client = new ScriptedRemoteControlClient(clock);
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        published = new ArrayList<>();
        resolver = () -> Revision.of("abc123");
        publisher = published::add;
    }

    private ConvergenceOrchestrator orchestrator() {
        var metrics = new ShiplockMetrics(registry);
        return new ConvergenceOrchestrator(
                resolver,
                publisher,
                new BuildPhaseController(client, clock, eventBus, metrics, new ShiplockProperties()),
                new DeployPhaseController(client, clock, eventBus, metrics),
                clock,
                eventBus,
                metrics);
    }

    private ConvergenceReport converge(PollConfig build, PollConfig deploy, CancellationToken token) {
        return orchestrator().converge("SHIP-test", new ConvergenceRequest(null, true, build, deploy, token));
    }

    private ConvergenceReport converge() {
        return converge(BUILD, DEPLOY, new CancellationToken());
    }

    @Nested
    @DisplayName("Successful runs")
    class SuccessTests {

        @Test
        @DisplayName("build succeeds at t=10, deploy observed at t=15 and t=20, converged at t=20")
        void convergesAfterBuildAndDeploy() {
            client.buildStatuses("PENDING", "PENDING", "SUCCESS");
            client.deployedRevisions("", "abc123");

            var report = converge();

            assertEquals(RunState.CONVERGED, report.finalState());
            assertEquals(0, report.exitCode());
            assertEquals(List.of(0L, 5L, 10L), client.buildPollTimes());
            assertEquals(List.of(15L, 20L), client.deployPollTimes());
            assertEquals(Duration.ofSeconds(20), report.elapsed());
            assertEquals(new BuildHandle("b1"), report.buildHandle());
            assertEquals("converged: deployed=abc123", report.message());
            assertEquals(1, client.submitCount());
            assertEquals(1, client.deployRequestCount());
            assertEquals(List.of(Revision.of("abc123")), published);
        }

        @Test
        void rerunForLiveRevisionConvergesOnFirstDeployPoll() {
            client.buildStatuses("SUCCESS");
            client.deployedRevisions("abc123");

            var first = converge();
            var second = converge();

            assertEquals(RunState.CONVERGED, first.finalState());
            assertEquals(RunState.CONVERGED, second.finalState());
            assertEquals(2, client.deployPollTimes().size());
        }

        @Test
        void explicitRevisionBypassesResolver() {
            resolver = () -> {
                throw new ResolutionException("should not be called");
            };
            client.buildStatuses("SUCCESS");
            client.deployedRevisions("def456");

            var report = orchestrator().converge(new ConvergenceRequest("def456", false, BUILD, DEPLOY, null));

            assertTrue(report.converged());
            assertEquals(List.of(Revision.of("def456")), client.submittedRevisions());
            assertTrue(published.isEmpty(), "publish disabled");
            assertTrue(report.runId().startsWith("SHIP-"));
        }

        @Test
        void publishesRunEventsInOrder() {
            client.buildStatuses("SUCCESS");
            client.deployedRevisions("abc123");
            var types = new ArrayList<String>();
            eventBus.attach("SHIP-test", e -> types.add(e.eventType()));

            converge();

            assertEquals("run.started", types.get(0));
            assertEquals("source.published", types.get(1));
            assertTrue(types.indexOf("build.succeeded") < types.indexOf("deploy.requested"));
            assertEquals("run.converged", types.get(types.size() - 1));
        }

        @Test
        void clearsMdcAfterRun() {
            client.buildStatuses("SUCCESS");
            client.deployedRevisions("abc123");

            converge();

            assertNull(MDC.get("runId"));
            assertNull(MDC.get("phase"));
        }
    }

    @Nested
    @DisplayName("Build failures")
    class BuildFailureTests {

        @Test
        void missingBuildIdFailsSubmissionWithoutPollingOrDeploying() {
            client.submitAnswers(new RemoteRejectedException("build id missing in acknowledgement: {}"));

            var report = converge();

            assertEquals(RunState.SUBMISSION_FAILED, report.finalState());
            assertEquals(20, report.exitCode());
            assertTrue(client.buildPollTimes().isEmpty());
            assertEquals(0, client.deployRequestCount());
            assertNull(report.buildHandle());
        }

        @Test
        void failedBuildNeverDeploys() {
            client.buildStatuses("RUNNING", "FAILED");

            var report = converge();

            assertEquals(RunState.BUILD_FAILED, report.finalState());
            assertEquals("build failed: status=FAILED", report.message());
            assertEquals(new BuildHandle("b1"), report.buildHandle());
            assertEquals(0, client.deployRequestCount());
        }

        @Test
        void cancelledBuildIsBuildFailure() {
            client.buildStatuses("CANCELLED");

            var report = converge();

            assertEquals(RunState.BUILD_FAILED, report.finalState());
            assertEquals("build failed: status=CANCELLED", report.message());
            assertEquals(21, report.exitCode());
        }

        @Test
        @DisplayName("RUNNING forever with timeout 10 and interval 5 times out at t=10 after two polls")
        void buildTimeout() {
            client.buildStatuses("RUNNING");

            var report = converge(PollConfig.ofSeconds(5, 10), DEPLOY, new CancellationToken());

            assertEquals(RunState.BUILD_TIMEOUT, report.finalState());
            assertEquals(22, report.exitCode());
            assertEquals(List.of(0L, 5L), client.buildPollTimes());
            assertEquals(Duration.ofSeconds(10), report.elapsed());
            assertEquals("build timeout after 10s, last status=RUNNING", report.message());
            assertEquals(new BuildHandle("b1"), report.buildHandle());
            assertEquals(0, client.deployRequestCount());
        }
    }

    @Nested
    @DisplayName("Deploy failures")
    class DeployFailureTests {

        @Test
        void deployRequestRejected() {
            client.buildStatuses("SUCCESS");
            client.failDeployRequest(new RemoteRejectedException("HTTP 400"));

            var report = converge();

            assertEquals(RunState.DEPLOY_REQUEST_FAILED, report.finalState());
            assertEquals(30, report.exitCode());
            assertTrue(client.deployPollTimes().isEmpty());
        }

        @Test
        void deployTimeout() {
            client.buildStatuses("SUCCESS");
            client.deployedRevisions("old999");

            var report = converge(BUILD, PollConfig.ofSeconds(5, 15).withSettleDelay(), new CancellationToken());

            assertEquals(RunState.DEPLOY_TIMEOUT, report.finalState());
            assertEquals(31, report.exitCode());
            assertEquals("deploy timeout after 15s: deployed=old999 expected=abc123", report.message());
        }
    }

    @Nested
    @DisplayName("Source failures")
    class SourceFailureTests {

        @Test
        void resolutionFailureStopsBeforeAnyRemoteCall() {
            resolver = () -> {
                throw new ResolutionException("git rev-parse HEAD exited with code 128: not a git repository");
            };

            var report = converge();

            assertEquals(RunState.RESOLUTION_FAILED, report.finalState());
            assertEquals(10, report.exitCode());
            assertTrue(report.revisionIfResolved().isEmpty());
            assertEquals(0, client.submitCount());
        }

        @Test
        void publishFailureStopsBeforeBuild() {
            publisher = revision -> {
                throw new PublishException("git push origin main exited with code 1: rejected");
            };

            var report = converge();

            assertEquals(RunState.PUBLISH_FAILED, report.finalState());
            assertEquals(11, report.exitCode());
            assertEquals(0, client.submitCount());
            assertTrue(report.message().startsWith("publish failed: "));
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        void cancelDuringBuildAbortsWithoutFurtherCalls() {
            client.buildStatuses("RUNNING");
            var token = new CancellationToken();
            clock.afterSleep(token::cancel);

            var report = converge(BUILD, DEPLOY, token);

            assertEquals(RunState.ABORTED, report.finalState());
            assertEquals(130, report.exitCode());
            assertEquals(1, client.buildPollTimes().size());
            assertEquals(0, client.deployRequestCount());
        }

        @Test
        void cancelledBeforeStartNeverResolves() {
            resolver = () -> {
                throw new AssertionError("resolver must not run");
            };
            var token = new CancellationToken();
            token.cancel();

            var report = converge(BUILD, DEPLOY, token);

            assertEquals(RunState.ABORTED, report.finalState());
            assertEquals(0, client.submitCount());
        }
    }

    @Test
    void recordsRunResultMetric() {
        client.buildStatuses("FAILED");

        converge();

        var counter = registry.find("shiplock.runs.total").tag("state", "BUILD_FAILED").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    void failedRunPublishesRunFailedEvent() {
        client.buildStatuses("FAILED");
        var failures = new ArrayList<ShiplockEvent>();
        eventBus.attach("SHIP-test", e -> {
            if ("run.failed".equals(e.eventType())) {
                failures.add(e);
            }
        });

        converge();

        assertEquals(1, failures.size());
        assertEquals("build", failures.get(0).phase());
        assertEquals("BUILD_FAILED", failures.get(0).payload().get("state"));
    }

    @Test
    @DisplayName("an API URL without scheme ends the run in SUBMISSION_FAILED")
    void misconfiguredApiUrlEndsInSubmissionFailed() {
        var properties = new NorthflankProperties();
        properties.setApiUrl("api.northflank.com");
        properties.setApiToken("nf-test-token");
        properties.setProjectId("poly2");
        properties.setServiceId("clawdbot");
        var apiClient = new NorthflankApiClient(properties);
        var metrics = new ShiplockMetrics(registry);
        var orchestrator = new ConvergenceOrchestrator(resolver, publisher,
                new BuildPhaseController(apiClient, clock, eventBus, metrics, new ShiplockProperties()),
                new DeployPhaseController(apiClient, clock, eventBus, metrics),
                clock, eventBus, metrics);
        var types = new ArrayList<String>();
        eventBus.attach("SHIP-test", e -> types.add(e.eventType()));

        var report = orchestrator.converge("SHIP-test",
                new ConvergenceRequest(null, true, BUILD, DEPLOY, new CancellationToken()));

        assertEquals(RunState.SUBMISSION_FAILED, report.finalState());
        assertEquals(20, report.exitCode());
        assertTrue(report.message().contains("Invalid Northflank API URL"));
        assertEquals("run.failed", types.get(types.size() - 1));
    }
}
