package com.shiplock.source;

import com.shiplock.core.ShiplockProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Git-backed revision source for the repository at {@code shiplock.git.repo-dir}.
 */
@Configuration
public class SourceConfig {

    @Bean
    public GitCommandRunner gitCommandRunner(ShiplockProperties properties) {
        return new GitCommandRunner(Path.of(properties.getRepoDir()).toAbsolutePath().normalize());
    }

    @Bean
    public RevisionResolver revisionResolver(GitCommandRunner gitCommandRunner) {
        return new GitRevisionResolver(gitCommandRunner);
    }

    @Bean
    public RevisionPublisher revisionPublisher(GitCommandRunner gitCommandRunner, ShiplockProperties properties) {
        return new GitPushPublisher(gitCommandRunner, properties.getRemote(), properties.getBranch());
    }
}
