package com.shiplock.dispatch.cli;

import com.shiplock.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: shiplock health
 * <p>
 * Checks that the local repository and the control plane are reachable.
 * Exits non-zero if any component is not UP.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check git and control plane reachability")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var checks = healthCheckService.checkAll();
        boolean allUp = true;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.info(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more components degraded or down");
        return 1;
    }
}
