package com.shiplock.dispatch.cli;

import com.shiplock.core.events.ShiplockEvent;
import com.shiplock.core.model.ConvergenceReport;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Shiplock CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SHIPLOCK v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SHIPLOCK]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void phase(String phase, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + phase.toUpperCase() + "]|@ " + message));
    }

    /**
     * Renders a run event as one console line. Progress lines carry phase,
     * attempt, elapsed time and last observed status so they can be grepped.
     */
    public static void event(ShiplockEvent event) {
        var p = event.payload();
        switch (event.eventType()) {
            case "run.started" -> info("run " + event.runId() + " revision=" + p.get("revision"));
            case "source.published" -> phase("source", "published revision=" + p.get("revision"));
            case "build.submitted" -> phase("build", "submitted handle=" + p.get("handle"));
            case "build.progress", "deploy.progress" -> phase(event.phase(),
                    (Boolean.TRUE.equals(p.get("transientFailure")) ? "remote unavailable, retrying " : "")
                    + "status=" + p.get("status")
                    + " elapsed=" + p.get("elapsedSeconds") + "s"
                    + " attempt=" + p.get("attempt"));
            case "build.succeeded" -> success("build success after " + p.get("elapsedSeconds") + "s");
            case "deploy.requested" -> phase("deploy", "requested revision=" + p.get("revision"));
            case "deploy.converged" -> success("deployed revision=" + p.get("revision"));
            case "run.converged", "run.failed" -> {
                // rendered by report()
            }
            default -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(white) [" + event.eventType() + "]|@ " + p));
        }
    }

    public static void report(ConvergenceReport report) {
        System.out.println("──────────────────────────────────");
        if (report.converged()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(green),bold [CONVERGED]|@ " + report.message()));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(red),bold [" + report.finalState() + "]|@ " + report.message()));
        }
        System.out.println("  Run: " + report.runId()
                + " | Duration: " + formatDuration(report.elapsed().toMillis())
                + " | Exit: " + report.exitCode());
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
