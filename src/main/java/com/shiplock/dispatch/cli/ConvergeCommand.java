package com.shiplock.dispatch.cli;

import com.shiplock.core.ShiplockProperties;
import com.shiplock.core.engine.ConvergenceOrchestrator;
import com.shiplock.core.engine.ConvergenceRequest;
import com.shiplock.core.events.EventBus;
import com.shiplock.core.model.ConvergenceReport;
import com.shiplock.core.model.PollConfig;
import com.shiplock.core.poll.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: shiplock converge [--revision &lt;sha&gt;]
 * <p>
 * Pushes, builds and deploys one revision and blocks until it is live.
 * The process exit code identifies the terminal state of the run.
 * Ctrl-C cancels the run and exits with the ABORTED code.
 */
@Command(name = "converge", mixinStandardHelpOptions = true,
        description = "Build and deploy a revision, then wait until it is live")
@Component
public class ConvergeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvergeCommand.class);

    @Option(names = {"--revision", "-r"}, description = "Revision to converge to (default: local HEAD)")
    private String revision;

    @Option(names = {"--no-push"}, description = "Skip pushing the branch before building")
    private boolean noPush;

    @Option(names = {"--poll-interval"}, description = "Seconds between polls (default: shiplock.poll.interval-seconds)")
    private Integer pollIntervalSeconds;

    @Option(names = {"--build-timeout"}, description = "Build phase timeout in seconds")
    private Integer buildTimeoutSeconds;

    @Option(names = {"--deploy-timeout"}, description = "Deploy phase timeout in seconds")
    private Integer deployTimeoutSeconds;

    private final ConvergenceOrchestrator orchestrator;
    private final EventBus eventBus;
    private final ShiplockProperties properties;

    public ConvergeCommand(ConvergenceOrchestrator orchestrator, EventBus eventBus, ShiplockProperties properties) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ConvergenceRequest request;
        try {
            request = buildRequest(new CancellationToken());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid polling options: " + e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }

        String runId = ConvergenceOrchestrator.newRunId();
        var token = request.token();
        var finished = new CountDownLatch(1);
        var shutdownHook = new Thread(() -> {
            if (finished.getCount() > 0) {
                ConsoleOutput.error("Interrupted, cancelling run " + runId);
                token.cancel();
                awaitQuietly(finished);
            }
        }, "shiplock-cancel");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try (var console = eventBus.attach(runId, ConsoleOutput::event)) {
            ConvergenceReport report = orchestrator.converge(runId, request);
            ConsoleOutput.report(report);
            return report.exitCode();
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }
    }

    ConvergenceRequest buildRequest(CancellationToken token) {
        int interval = pollIntervalSeconds != null ? pollIntervalSeconds : properties.getPollIntervalSeconds();
        int buildTimeout = buildTimeoutSeconds != null ? buildTimeoutSeconds : properties.getBuildTimeoutSeconds();
        int deployTimeout = deployTimeoutSeconds != null ? deployTimeoutSeconds : properties.getDeployTimeoutSeconds();

        var buildConfig = PollConfig.ofSeconds(interval, buildTimeout);
        var deployConfig = PollConfig.ofSeconds(interval, deployTimeout).withSettleDelay();
        boolean publish = properties.isPushEnabled() && !noPush;

        return new ConvergenceRequest(revision, publish, buildConfig, deployConfig, token);
    }

    private static void awaitQuietly(CountDownLatch finished) {
        try {
            if (!finished.await(5, TimeUnit.SECONDS)) {
                log.warn("Run did not stop within 5s of cancellation");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook has run or is running
            log.debug("Shutdown in progress, cancel hook left in place");
        }
    }
}
