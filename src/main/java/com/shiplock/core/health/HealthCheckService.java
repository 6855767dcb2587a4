package com.shiplock.core.health;

import com.shiplock.remote.RemoteControlClient;
import com.shiplock.remote.RemoteControlException;
import com.shiplock.source.GitCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final RemoteControlClient remoteControlClient;
    private final GitCommandRunner git;

    public HealthCheckService(RemoteControlClient remoteControlClient, GitCommandRunner git) {
        this.remoteControlClient = remoteControlClient;
        this.git = git;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGit());
        results.add(checkControlPlane());
        return results;
    }

    private HealthStatus checkGit() {
        var metadata = Map.of("repoDir", git.workDir().toString());
        try {
            var result = git.run("rev-parse", "--is-inside-work-tree");
            if (result.ok() && "true".equals(result.output())) {
                return new HealthStatus("git", HealthStatus.Status.UP,
                        "Repository at " + git.workDir(), metadata);
            }
            return new HealthStatus("git", HealthStatus.Status.DOWN,
                    "Not a git work tree: " + git.workDir(), metadata);
        } catch (IOException e) {
            log.warn("git health check failed: {}", e.getMessage());
            return new HealthStatus("git", HealthStatus.Status.DOWN,
                    "git not available: " + e.getMessage(), metadata);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new HealthStatus("git", HealthStatus.Status.DOWN, "Interrupted", metadata);
        }
    }

    private HealthStatus checkControlPlane() {
        var metadata = Map.of("endpoint", remoteControlClient.describe());
        try {
            var deployed = remoteControlClient.getDeployedRevision();
            return new HealthStatus("control-plane", HealthStatus.Status.UP,
                    "Reachable, deployed=" + (deployed.isEmpty() ? "<none>" : deployed), metadata);
        } catch (RemoteControlException e) {
            log.warn("control plane health check failed: {}", e.getMessage());
            var status = e.isTransient() ? HealthStatus.Status.DEGRADED : HealthStatus.Status.DOWN;
            return new HealthStatus("control-plane", status, e.getMessage(), metadata);
        }
    }
}
