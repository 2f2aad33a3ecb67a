package com.tandem.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tandem.core.events.EventBus;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.merge.JsonlEntityResolver;
import com.tandem.merge.LineMerger;
import com.tandem.sync.ExecutionRecordStore;
import com.tandem.sync.JsonFileExecutionRecordStore;
import com.tandem.sync.WorktreeSyncService;
import com.tandem.worktree.ConflictDetector;
import com.tandem.worktree.GitCli;
import com.tandem.worktree.StructuredLogMatcher;
import com.tandem.worktree.WorktreeManager;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the git-backed services against the repository at {@code tandem.repo-path}.
 */
@Configuration
public class RepositoryConfig {

    @Bean
    public GitCli gitCli(TandemProperties properties) {
        return new GitCli(properties.getGitExecutable());
    }

    @Bean
    public LineMerger lineMerger(TandemProperties properties,
                                 @Autowired(required = false) TandemMetrics metrics) {
        return new LineMerger(properties.getGitExecutable(), metrics);
    }

    @Bean
    public JsonlEntityResolver jsonlEntityResolver(ObjectMapper objectMapper) {
        return new JsonlEntityResolver(objectMapper);
    }

    @Bean
    public StructuredLogMatcher structuredLogMatcher(TandemProperties properties) {
        return new StructuredLogMatcher(properties.getStructuredLogs());
    }

    @Bean
    public ConflictDetector conflictDetector(GitCli gitCli, LineMerger lineMerger,
                                             StructuredLogMatcher structuredLogMatcher,
                                             TandemProperties properties) {
        return new ConflictDetector(gitCli, lineMerger, structuredLogMatcher, repoPath(properties));
    }

    /**
     * Creates isolated checkouts per execution; branches are kept after removal
     * so they can still be synced.
     */
    @Bean
    public WorktreeManager worktreeManager(GitCli gitCli, TandemProperties properties) {
        return new WorktreeManager(gitCli, repoPath(properties), Path.of(properties.getWorktreeRoot()),
                properties.getBranchPrefix());
    }

    @Bean
    public ExecutionRecordStore executionRecordStore(TandemProperties properties, ObjectMapper objectMapper) {
        Path store = Path.of(properties.getStorePath());
        return new JsonFileExecutionRecordStore(
                store.isAbsolute() ? store : repoPath(properties).resolve(store), objectMapper);
    }

    @Bean
    public WorktreeSyncService worktreeSyncService(GitCli gitCli, ConflictDetector conflictDetector,
                                                   LineMerger lineMerger, JsonlEntityResolver jsonlEntityResolver,
                                                   StructuredLogMatcher structuredLogMatcher,
                                                   ExecutionRecordStore executionRecordStore,
                                                   TandemProperties properties, EventBus eventBus,
                                                   @Autowired(required = false) TandemMetrics metrics) {
        return new WorktreeSyncService(gitCli, conflictDetector, lineMerger, jsonlEntityResolver,
                structuredLogMatcher, executionRecordStore, repoPath(properties),
                properties.getBackupTagPrefix(), eventBus, metrics);
    }

    private static Path repoPath(TandemProperties properties) {
        return Path.of(properties.getRepoPath()).toAbsolutePath().normalize();
    }
}
