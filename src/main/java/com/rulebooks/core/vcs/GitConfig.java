package com.rulebooks.core.vcs;

import com.rulebooks.core.importer.ImporterProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the CLI-backed {@link GitClient} unless another implementation is registered.
 */
@Configuration
public class GitConfig {

    @Bean
    @ConditionalOnMissingBean(GitClient.class)
    public GitClient gitClient(ImporterProperties properties) {
        return new GitCliClient(properties.getGitExecutable());
    }
}
