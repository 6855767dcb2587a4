package com.shiplock.remote.northflank;

import com.shiplock.core.model.Revision;
import com.shiplock.remote.RemoteRejectedException;
import com.shiplock.remote.RemoteTransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NorthflankCliClientTest {

    private NorthflankProperties properties;
    private StubCliClient client;

    @BeforeEach
    void setUp() {
        properties = new NorthflankProperties();
        properties.setTransport("cli");
        properties.setProjectId("poly2");
        properties.setServiceId("clawdbot");
        client = new StubCliClient(properties);
    }

    @Test
    void buildCommandAppendsServiceSelectorAndJsonOutput() {
        var command = client.buildCommand(List.of("get", "service", "deployment"));

        assertEquals(List.of("northflank", "get", "service", "deployment",
                "--projectId", "poly2", "--serviceId", "clawdbot", "--output", "json"), command);
    }

    @Test
    void submitBuildUsesStartServiceBuild() {
        client.output = "{\"id\":\"b-7\"}";

        var handle = client.submitBuild(Revision.of("abc123"));

        assertEquals("b-7", handle.id());
        var args = client.invocations.get(0);
        assertEquals(List.of("start", "service", "build", "--input"), args.subList(0, 4));
        assertTrue(args.get(4).contains("\"sha\":\"abc123\""));
    }

    @Test
    void submitBuildWithoutIdIsRejected() {
        client.output = "{\"status\":\"QUEUED\"}";

        assertThrows(RemoteRejectedException.class, () -> client.submitBuild(Revision.of("abc123")));
    }

    @Test
    void listRecentBuildsParsesUnwrappedOutput() {
        client.output = "{\"builds\":[{\"id\":\"b-7\",\"status\":\"FAILED\"}]}";

        var builds = client.listRecentBuilds(40);

        assertEquals(List.of("get", "service", "builds", "--per_page", "40"), client.invocations.get(0));
        assertEquals(1, builds.size());
        assertEquals("FAILED", builds.get(0).rawStatus());
        assertNull(builds.get(0).revision());
    }

    @Test
    void requestDeploymentPassesBranchAndSha() {
        client.requestDeployment(Revision.of("abc123"));

        var args = client.invocations.get(0);
        assertEquals(List.of("update", "service", "deployment", "--input"), args.subList(0, 4));
        assertTrue(args.get(4).contains("\"buildSHA\":\"abc123\""));
        assertTrue(args.get(4).contains("\"branch\":\"main\""));
    }

    @Test
    void deployedRevisionFromCliOutput() {
        client.output = "{\"internal\":{\"deployedSHA\":\"abc123\"}}";

        assertEquals("abc123", client.getDeployedRevision());
    }

    @Test
    void nonJsonOutputIsRejected() {
        client.output = "Error: not logged in";

        assertThrows(RemoteRejectedException.class, () -> client.getDeployedRevision());
    }

    @Test
    void describeNamesCliAndService() {
        assertEquals("northflank-cli northflank (poly2/clawdbot)", client.describe());
    }

    @Nested
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("Real process execution")
    class ProcessTests {

        @TempDir
        Path dir;

        private NorthflankCliClient clientFor(String script) throws IOException {
            var executable = dir.resolve("northflank");
            Files.writeString(executable, "#!/bin/sh\n" + script + "\n");
            assertTrue(executable.toFile().setExecutable(true));
            properties.setCliCommand(executable.toString());
            return new NorthflankCliClient(properties);
        }

        @Test
        void hungProcessIsKilledAtRequestTimeout() throws IOException {
            var cli = clientFor("sleep 20");
            properties.setRequestTimeoutSeconds(1);

            var e = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> assertThrows(RemoteTransportException.class, cli::getDeployedRevision));
            assertTrue(e.isTransient());
            assertTrue(e.getMessage().contains("timed out"));
        }

        @Test
        void readsOutputOfFinishedProcess() throws IOException {
            var cli = clientFor("echo '{\"internal\":{\"deployedSHA\":\"abc123\"}}'");

            assertEquals("abc123", cli.getDeployedRevision());
        }

        @Test
        void nonZeroExitIsRejectedWithOutput() throws IOException {
            var cli = clientFor("echo 'Error: not logged in' >&2; exit 3");

            var e = assertThrows(RemoteRejectedException.class, cli::getDeployedRevision);
            assertTrue(e.getMessage().contains("code 3"));
            assertTrue(e.getMessage().contains("not logged in"));
        }
    }

    // --- Stub that replaces the process call ---

    static class StubCliClient extends NorthflankCliClient {

        final List<List<String>> invocations = new ArrayList<>();
        String output = "{}";

        StubCliClient(NorthflankProperties properties) {
            super(properties);
        }

        @Override
        String runCli(List<String> args) {
            invocations.add(args);
            return output;
        }
    }
}
