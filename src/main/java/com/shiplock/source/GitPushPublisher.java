package com.shiplock.source;

import com.shiplock.core.failure.PublishException;
import com.shiplock.core.model.Revision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Publishes by pushing the configured branch to the configured remote.
 */
public class GitPushPublisher implements RevisionPublisher {

    private static final Logger log = LoggerFactory.getLogger(GitPushPublisher.class);

    private final GitCommandRunner git;
    private final String remote;
    private final String branch;

    public GitPushPublisher(GitCommandRunner git, String remote, String branch) {
        this.git = git;
        this.remote = remote;
        this.branch = branch;
    }

    @Override
    public void publish(Revision revision) {
        log.info("Pushing {} to {}/{}", revision.shortValue(), remote, branch);

        GitCommandRunner.GitResult result;
        try {
            result = git.run("push", remote, branch);
        } catch (IOException e) {
            throw new PublishException("cannot run git push in " + git.workDir(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException("interrupted during git push", e);
        }

        if (!result.ok()) {
            throw new PublishException("git push %s %s exited with code %d: %s".formatted(
                    remote, branch, result.exitCode(), GitCommandRunner.maskSensitiveData(result.output())));
        }
        log.info("Pushed {} to {}/{}", revision.shortValue(), remote, branch);
    }
}
