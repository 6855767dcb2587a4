package com.shiplock.dispatch.cli;

import com.shiplock.core.ShiplockProperties;
import com.shiplock.core.failure.ResolutionException;
import com.shiplock.core.model.Outcome;
import com.shiplock.core.status.StatusClassifier;
import com.shiplock.remote.RemoteControlClient;
import com.shiplock.remote.RemoteControlException;
import com.shiplock.source.RevisionResolver;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: shiplock status
 * <p>
 * Compares the live revision with the local HEAD and lists recent builds.
 * Read-only: never pushes, builds or deploys.
 */
@Command(name = "status", mixinStandardHelpOptions = true,
        description = "Show the live revision, local HEAD and recent builds")
@Component
public class StatusCommand implements Callable<Integer> {

    @Option(names = {"--limit", "-n"}, description = "Number of recent builds to show (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int limit;

    private final RemoteControlClient client;
    private final RevisionResolver revisionResolver;
    private final ShiplockProperties properties;

    public StatusCommand(RemoteControlClient client, RevisionResolver revisionResolver,
                         ShiplockProperties properties) {
        this.client = client;
        this.revisionResolver = revisionResolver;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Control plane: " + client.describe());

        String deployed;
        try {
            deployed = client.getDeployedRevision();
        } catch (RemoteControlException e) {
            ConsoleOutput.error("Cannot read deployment: " + e.getMessage());
            return 1;
        }

        String local = null;
        try {
            local = revisionResolver.resolve().value();
        } catch (ResolutionException e) {
            ConsoleOutput.error(e.getMessage());
        }

        System.out.println();
        System.out.println("Deployed:   " + (deployed.isEmpty() ? "<none>" : deployed));
        System.out.println("Local HEAD: " + (local != null ? local : "<unknown>"));
        if (local != null && local.equals(deployed)) {
            ConsoleOutput.success("Local HEAD is live");
        } else if (local != null) {
            ConsoleOutput.info("Local HEAD is not live. Run 'shiplock converge' to deploy it.");
        }

        int shown = Math.min(limit, properties.getBuildListLimit());
        try {
            var builds = client.listRecentBuilds(shown);
            System.out.println();
            System.out.println("RECENT BUILDS:");
            if (builds.isEmpty()) {
                System.out.println("  (none)");
            }
            builds.stream().limit(shown).forEach(b -> {
                Outcome outcome = StatusClassifier.classify(b.rawStatus());
                System.out.printf("  %-28s %-10s %s%n", b.handle().id(), outcome,
                        b.revision() != null ? b.revision() : "");
            });
        } catch (RemoteControlException e) {
            ConsoleOutput.error("Cannot list builds: " + e.getMessage());
            return 1;
        }
        return 0;
    }
}
