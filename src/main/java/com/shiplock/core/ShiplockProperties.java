package com.shiplock.core;

import com.shiplock.core.model.PollConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "shiplock")
public class ShiplockProperties {

    private Git git = new Git();
    private Poll poll = new Poll();

    // -- Git accessors (delegate to nested) --
    public String getRepoDir() { return git.repoDir; }
    public String getRemote() { return git.remote; }
    public String getBranch() { return git.branch; }
    public boolean isPushEnabled() { return git.pushEnabled; }

    // -- Poll accessors (delegate to nested) --
    public int getPollIntervalSeconds() { return poll.intervalSeconds; }
    public int getBuildTimeoutSeconds() { return poll.buildTimeoutSeconds; }
    public int getDeployTimeoutSeconds() { return poll.deployTimeoutSeconds; }
    public int getBuildListLimit() { return poll.buildListLimit; }

    /** Build phase cadence: first poll immediately after submission. */
    public PollConfig buildPollConfig() {
        return PollConfig.of(Duration.ofSeconds(poll.intervalSeconds),
                Duration.ofSeconds(poll.buildTimeoutSeconds));
    }

    /** Deploy phase cadence: first poll one interval after the request. */
    public PollConfig deployPollConfig() {
        return PollConfig.of(Duration.ofSeconds(poll.intervalSeconds),
                Duration.ofSeconds(poll.deployTimeoutSeconds)).withSettleDelay();
    }

    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Poll getPoll() { return poll; }
    public void setPoll(Poll poll) { this.poll = poll; }

    public static class Git {
        private String repoDir = ".";
        private String remote = "origin";
        private String branch = "main";
        private boolean pushEnabled = true;

        public String getRepoDir() { return repoDir; }
        public void setRepoDir(String repoDir) { this.repoDir = repoDir; }
        public String getRemote() { return remote; }
        public void setRemote(String remote) { this.remote = remote; }
        public String getBranch() { return branch; }
        public void setBranch(String branch) { this.branch = branch; }
        public boolean isPushEnabled() { return pushEnabled; }
        public void setPushEnabled(boolean pushEnabled) { this.pushEnabled = pushEnabled; }
    }

    public static class Poll {
        private int intervalSeconds = 5;
        private int buildTimeoutSeconds = 900;
        private int deployTimeoutSeconds = 600;
        private int buildListLimit = 40;

        public int getIntervalSeconds() { return intervalSeconds; }
        public void setIntervalSeconds(int intervalSeconds) { this.intervalSeconds = intervalSeconds; }
        public int getBuildTimeoutSeconds() { return buildTimeoutSeconds; }
        public void setBuildTimeoutSeconds(int buildTimeoutSeconds) { this.buildTimeoutSeconds = buildTimeoutSeconds; }
        public int getDeployTimeoutSeconds() { return deployTimeoutSeconds; }
        public void setDeployTimeoutSeconds(int deployTimeoutSeconds) { this.deployTimeoutSeconds = deployTimeoutSeconds; }
        public int getBuildListLimit() { return buildListLimit; }
        public void setBuildListLimit(int buildListLimit) { this.buildListLimit = buildListLimit; }
    }
}
