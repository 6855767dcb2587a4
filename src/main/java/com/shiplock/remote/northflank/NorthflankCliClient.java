package com.shiplock.remote.northflank;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shiplock.core.model.BuildHandle;
import com.shiplock.core.model.BuildRecord;
import com.shiplock.core.model.Revision;
import com.shiplock.remote.RemoteControlClient;
import com.shiplock.remote.RemoteRejectedException;
import com.shiplock.remote.RemoteTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link RemoteControlClient} that shells out to the {@code northflank} CLI.
 *
 * <p>Useful where the CLI is already logged in and no API token is
 * provisioned. Every call appends {@code --projectId}, {@code --serviceId}
 * and {@code --output json} and parses stdout with Jackson.
 */
public class NorthflankCliClient implements RemoteControlClient {

    private static final Logger log = LoggerFactory.getLogger(NorthflankCliClient.class);

    private final NorthflankProperties properties;
    private final ObjectMapper objectMapper;

    public NorthflankCliClient(NorthflankProperties properties) {
        this.properties = properties;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public BuildHandle submitBuild(Revision revision) {
        ObjectNode input = objectMapper.createObjectNode();
        input.put("sha", revision.value());

        var response = parse(runCli(List.of("start", "service", "build", "--input", input.toString())),
                "start service build");

        var buildId = NorthflankResponses.buildId(response);
        if (buildId.isEmpty()) {
            throw new RemoteRejectedException("build id missing in CLI output: " + response);
        }
        log.info("Started Northflank build {} for sha {} via CLI", buildId, revision);
        return new BuildHandle(buildId);
    }

    @Override
    public List<BuildRecord> listRecentBuilds(int limit) {
        var output = runCli(List.of("get", "service", "builds", "--per_page", String.valueOf(limit)));
        return NorthflankResponses.builds(parse(output, "get service builds"));
    }

    @Override
    public void requestDeployment(Revision revision) {
        ObjectNode input = objectMapper.createObjectNode();
        input.put("branch", properties.getBranch());
        input.put("buildSHA", revision.value());

        runCli(List.of("update", "service", "deployment", "--input", input.toString()));
        log.info("Requested Northflank deployment of sha {} via CLI", revision);
    }

    @Override
    public String getDeployedRevision() {
        var output = runCli(List.of("get", "service", "deployment"));
        return NorthflankResponses.deployedRevision(parse(output, "get service deployment"));
    }

    @Override
    public String describe() {
        return "northflank-cli %s (%s/%s)".formatted(
                properties.getCliCommand(), properties.getProjectId(), properties.getServiceId());
    }

    List<String> buildCommand(List<String> args) {
        var command = new ArrayList<String>();
        command.add(properties.getCliCommand());
        command.addAll(args);
        command.add("--projectId");
        command.add(properties.getProjectId());
        command.add("--serviceId");
        command.add(properties.getServiceId());
        command.add("--output");
        command.add("json");
        return command;
    }

    /**
     * Runs the CLI and returns its combined output.
     *
     * <p>Output goes to a temporary file rather than a pipe, so the wait below is
     * bounded by {@code requestTimeoutSeconds} even when the process never closes
     * its stdout.
     *
     * @throws RemoteTransportException if the process cannot be started or does not finish in time
     * @throws RemoteRejectedException  if it exits non-zero
     */
    String runCli(List<String> args) {
        var command = buildCommand(args);
        log.debug("Running: {}", String.join(" ", command));

        Path outputFile = null;
        try {
            outputFile = Files.createTempFile("shiplock-northflank-", ".out");
            var process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();

            if (!process.waitFor(properties.getRequestTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new RemoteTransportException("northflank CLI timed out after %ds: %s"
                        .formatted(properties.getRequestTimeoutSeconds(), String.join(" ", args)));
            }

            String output = Files.readString(outputFile, StandardCharsets.UTF_8).strip();
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new RemoteRejectedException("northflank CLI exited with code %d: %s"
                        .formatted(exitCode, output));
            }
            return output;
        } catch (IOException e) {
            throw new RemoteTransportException("Failed to run northflank CLI: " + String.join(" ", args), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteTransportException("Interrupted while running northflank CLI", e);
        } finally {
            deleteQuietly(outputFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete CLI output file {}: {}", file, e.getMessage());
        }
    }

    private JsonNode parse(String output, String context) {
        try {
            return objectMapper.readTree(output);
        } catch (IOException e) {
            throw new RemoteRejectedException("Unparseable northflank CLI output for " + context, e);
        }
    }
}
