package com.shiplock.source;

import com.shiplock.core.failure.ResolutionException;
import com.shiplock.core.model.Revision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Resolves the current local revision with {@code git rev-parse HEAD}.
 */
public class GitRevisionResolver implements RevisionResolver {

    private static final Logger log = LoggerFactory.getLogger(GitRevisionResolver.class);

    private final GitCommandRunner git;

    public GitRevisionResolver(GitCommandRunner git) {
        this.git = git;
    }

    @Override
    public Revision resolve() {
        GitCommandRunner.GitResult result;
        try {
            result = git.run("rev-parse", "HEAD");
        } catch (IOException e) {
            throw new ResolutionException("cannot run git in " + git.workDir(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolutionException("interrupted while running git rev-parse", e);
        }

        if (!result.ok()) {
            throw new ResolutionException("git rev-parse HEAD exited with code %d: %s"
                    .formatted(result.exitCode(), result.output()));
        }
        if (result.output().isBlank()) {
            throw new ResolutionException("git rev-parse HEAD printed nothing in " + git.workDir());
        }

        var revision = Revision.of(result.output().lines().findFirst().orElse(""));
        log.info("Resolved local HEAD to {}", revision);
        return revision;
    }
}
