package com.tandem.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tandem.core.events.EventBus;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.merge.JsonlEntityResolver;
import com.tandem.merge.LineMerger;
import com.tandem.support.GitTestRepo;
import com.tandem.worktree.ConflictDetector;
import com.tandem.worktree.ConflictReport;
import com.tandem.worktree.StructuredLogMatcher;
import com.tandem.worktree.WorktreeManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests for {@link WorktreeSyncService} on scratch repositories.
 */
class WorktreeSyncServiceTest {

    private static final String TAG_PREFIX = "tandem-sync-before-";

    @TempDir
    Path dir;

    private GitTestRepo repo;
    private WorktreeManager worktrees;
    private ExecutionRecordStore records;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private WorktreeSyncService service;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(GitTestRepo.gitAvailable(), "git not installed");
        repo = GitTestRepo.init(dir);
        repo.write("issues.jsonl", "{\"id\":\"ISS-1\",\"uuid\":\"u-1\",\"created_at\":\"2024-01-01T00:00:00Z\"}\n")
                .write("src/App.java", "class App {\n    int a = 1;\n}\n")
                .commitAll("seed");
        worktrees = new WorktreeManager(repo.cli(), dir, Path.of(".tandem/worktrees"), "tandem/");
        records = new JsonFileExecutionRecordStore(dir.resolve(".tandem/executions.json"), new ObjectMapper());
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        service = newService(new ConflictDetector(repo.cli(), new LineMerger("git"),
                StructuredLogMatcher.defaults(), dir));
    }

    private WorktreeSyncService newService(ConflictDetector detector) {
        return new WorktreeSyncService(repo.cli(), detector, new LineMerger("git"),
                new JsonlEntityResolver(new ObjectMapper()), StructuredLogMatcher.defaults(), records, dir,
                TAG_PREFIX, eventBus, new TandemMetrics(registry));
    }

    private ExecutionRecord startExecution(String id) {
        WorktreeManager.WorktreeResult created = worktrees.createWorktree(id, "main");
        assertTrue(created.success(), created.error());
        var record = new ExecutionRecord(id, "ISS-1", ExecutionStatus.COMPLETED, created.worktreePath().toString(),
                created.branchName(), "main", null, null);
        records.save(record);
        return record;
    }

    private void commitInWorktree(ExecutionRecord execution, String path, String content) throws Exception {
        Path file = Path.of(execution.worktreePath()).resolve(path);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        assertTrue(worktrees.commitAll(Path.of(execution.worktreePath()), "agent: " + path));
    }

    private List<String> backupTags() {
        return repo.git("tag", "-l", TAG_PREFIX + "*").lines().filter(l -> !l.isBlank()).toList();
    }

    @Nested
    @DisplayName("squashSync")
    class SquashSyncTests {

        @Test
        @DisplayName("lands the execution as one commit and tags the previous target")
        void squashesOntoTarget() throws Exception {
            ExecutionRecord execution = startExecution("exec-1");
            commitInWorktree(execution, "feature.txt", "feature\n");
            commitInWorktree(execution, "more.txt", "more\n");
            String before = repo.revParse("main");
            var events = new CopyOnWriteArrayList<String>();
            eventBus.subscribe("exec-1", (TandemEvent e) -> events.add(e.eventType()));

            SyncResult result = service.squashSync("exec-1");

            assertTrue(result.success(), String.join("; ", result.warnings()));
            assertNull(result.errorCode());
            assertTrue(result.backupTag().startsWith(TAG_PREFIX + "exec-1-"));
            assertEquals(before, repo.revParse(result.backupTag() + "^{commit}"));
            assertEquals(result.finalCommit(), repo.revParse("main"));
            assertEquals(before, repo.revParse("main^"));
            assertEquals(2, result.filesChanged());
            assertEquals("feature\n", repo.read("feature.txt"));

            String message = repo.git("log", "-1", "--format=%B", "main");
            assertTrue(message.startsWith("Squash merge from tandem/exec-1 (2 commits)"));
            assertTrue(message.contains("Execution: exec-1"));

            assertEquals(result.finalCommit(), records.find("exec-1").orElseThrow().afterCommit());
            assertEquals("main", repo.currentBranch());
            assertEquals(List.of("sync.completed"), events);
            assertEquals(1.0, registry.find("tandem.sync.total").tag("result", "success").counter().count());
        }

        @Test
        @DisplayName("uses a custom commit message when given")
        void customMessage() throws Exception {
            ExecutionRecord execution = startExecution("exec-1");
            commitInWorktree(execution, "feature.txt", "feature\n");

            SyncResult result = service.squashSync("exec-1", "Add feature");

            assertTrue(result.success());
            assertEquals("Add feature", repo.git("log", "-1", "--format=%s", "main"));
        }

        @Test
        @DisplayName("merges structured logs changed on both sides automatically")
        void resolvesStructuredLogs() throws Exception {
            ExecutionRecord execution = startExecution("exec-1");
            commitInWorktree(execution, "issues.jsonl",
                    "{\"id\":\"ISS-1\",\"uuid\":\"u-1\",\"created_at\":\"2024-01-01T00:00:00Z\"}\n"
                            + "{\"id\":\"ISS-2\",\"uuid\":\"u-2\",\"created_at\":\"2024-01-02T00:00:00Z\"}\n");
            repo.write("issues.jsonl",
                    "{\"id\":\"ISS-1\",\"uuid\":\"u-1\",\"created_at\":\"2024-01-01T00:00:00Z\"}\n"
                            + "{\"id\":\"ISS-3\",\"uuid\":\"u-3\",\"created_at\":\"2024-01-03T00:00:00Z\"}\n")
                    .commitAll("main adds ISS-3");

            SyncResult result = service.squashSync("exec-1");

            assertTrue(result.success(), String.join("; ", result.warnings()));
            assertEquals(1, result.jsonlFilesResolved());
            String merged = repo.read("issues.jsonl");
            assertFalse(merged.contains("<<<<<<<"));
            assertTrue(merged.contains("ISS-1"));
            assertTrue(merged.contains("ISS-2"));
            assertTrue(merged.contains("ISS-3"));
            assertEquals(1.0, registry.get("tandem.sync.jsonl_resolved").counter().count());
        }

        @Test
        @DisplayName("code conflicts stop the sync before anything is tagged or changed")
        void refusesCodeConflicts() throws Exception {
            ExecutionRecord execution = startExecution("exec-1");
            commitInWorktree(execution, "src/App.java", "class App {\n    int a = 2;\n}\n");
            repo.write("src/App.java", "class App {\n    int a = 3;\n}\n").commitAll("main edit");
            String before = repo.revParse("main");

            SyncResult result = service.squashSync("exec-1");

            assertFalse(result.success());
            assertEquals(SyncErrorCode.CODE_CONFLICTS, result.errorCode());
            assertNull(result.backupTag());
            assertFalse(result.warnings().isEmpty());
            assertEquals(before, repo.revParse("main"));
            assertTrue(backupTags().isEmpty());
            assertEquals("", repo.git("status", "--porcelain", "--untracked-files=no"));
        }

        @Test
        @DisplayName("a binary file changed on both sides is refused as a code conflict")
        void refusesBinaryConflict() throws Exception {
            repo.writeBytes("logo.bin", new byte[] {0, 1, 2, 3, 0, 5}).commitAll("add logo");
            ExecutionRecord execution = startExecution("exec-1");
            Files.write(Path.of(execution.worktreePath()).resolve("logo.bin"), new byte[] {0, 9, 9, 9, 0, 5});
            assertTrue(worktrees.commitAll(Path.of(execution.worktreePath()), "agent: logo"));
            repo.writeBytes("logo.bin", new byte[] {0, 7, 7, 7, 0, 5}).commitAll("main logo");
            String before = repo.revParse("main");

            SyncPreview preview = service.previewSync("exec-1");
            SyncResult result = service.squashSync("exec-1");

            assertFalse(preview.canSync());
            assertEquals("logo.bin", preview.conflicts().codeConflicts().get(0).filePath());
            assertFalse(result.success());
            assertEquals(SyncErrorCode.CODE_CONFLICTS, result.errorCode());
            assertEquals(before, repo.revParse("main"));
            assertTrue(backupTags().isEmpty());
        }

        @Test
        @DisplayName("a conflict found only during the squash rolls back and keeps the backup tag")
        void rollsBackLateConflict() throws Exception {
            ExecutionRecord execution = startExecution("exec-1");
            commitInWorktree(execution, "src/App.java", "class App {\n    int a = 2;\n}\n");
            repo.write("src/App.java", "class App {\n    int a = 3;\n}\n").commitAll("main edit");
            String before = repo.revParse("main");
            String contentBefore = repo.read("src/App.java");
            ConflictDetector blind = mock(ConflictDetector.class);
            when(blind.detectConflicts(anyString(), anyString(), anyString())).thenReturn(ConflictReport.none());

            SyncResult result = newService(blind).squashSync("exec-1");

            assertFalse(result.success());
            assertEquals(SyncErrorCode.CODE_CONFLICTS, result.errorCode());
            assertNull(result.backupTag());
            assertEquals(before, repo.revParse("main"));
            assertEquals(contentBefore, repo.read("src/App.java"));
            assertEquals("", repo.git("status", "--porcelain", "--untracked-files=no"));
            assertEquals(1, backupTags().size());
        }

        @Test
        @DisplayName("an execution without commits has nothing to sync")
        void nothingToSync() {
            startExecution("exec-1");

            SyncResult result = service.squashSync("exec-1");

            assertFalse(result.success());
            assertEquals(SyncErrorCode.NOTHING_TO_SYNC, result.errorCode());
            assertTrue(backupTags().isEmpty());
        }

        @Test
        @DisplayName("uncommitted tracked changes in the main checkout block the sync")
        void dirtyCheckout() throws Exception {
            ExecutionRecord execution = startExecution("exec-1");
            commitInWorktree(execution, "feature.txt", "feature\n");
            repo.write("README.md", "local edit\n");

            var e = assertThrows(WorktreeSyncException.class, () -> service.squashSync("exec-1"));
            assertEquals(SyncErrorCode.DIRTY_WORKING_TREE, e.getCode());
        }

        @Test
        @DisplayName("an unknown execution is rejected")
        void unknownExecution() {
            var e = assertThrows(WorktreeSyncException.class, () -> service.squashSync("missing"));
            assertEquals(SyncErrorCode.EXECUTION_NOT_FOUND, e.getCode());
        }

        @Test
        @DisplayName("per-execution locks are dropped once a sync returns or throws")
        void releasesExecutionLocks() throws Exception {
            ExecutionRecord execution = startExecution("exec-1");
            commitInWorktree(execution, "feature.txt", "feature\n");

            assertTrue(service.squashSync("exec-1").success());
            assertThrows(WorktreeSyncException.class, () -> service.squashSync("missing"));

            assertEquals(0, service.executionLockCount());
        }

        @Test
        @DisplayName("a removed worktree is reported as missing")
        void missingWorktree() {
            startExecution("exec-1");
            worktrees.removeWorktree("exec-1");

            var e = assertThrows(WorktreeSyncException.class, () -> service.squashSync("exec-1"));
            assertEquals(SyncErrorCode.WORKTREE_MISSING, e.getCode());
        }

        @Test
        @DisplayName("a deleted target branch is reported")
        void missingTarget() {
            ExecutionRecord execution = startExecution("exec-1");
            records.save(new ExecutionRecord("exec-1", null, ExecutionStatus.COMPLETED, execution.worktreePath(),
                    execution.branchName(), "release", null, null));

            var e = assertThrows(WorktreeSyncException.class, () -> service.squashSync("exec-1"));
            assertEquals(SyncErrorCode.TARGET_BRANCH_MISSING, e.getCode());
        }
    }

    @Nested
    @DisplayName("previewSync")
    class PreviewTests {

        @Test
        @DisplayName("describes the pending sync without changing anything")
        void previewsWithoutMutation() throws Exception {
            ExecutionRecord execution = startExecution("exec-1");
            commitInWorktree(execution, "feature.txt", "one\ntwo\n");
            Files.writeString(Path.of(execution.worktreePath()).resolve("scratch.txt"), "wip\n");
            String before = repo.revParse("main");

            SyncPreview preview = service.previewSync("exec-1");

            assertTrue(preview.canSync(), String.join("; ", preview.warnings()));
            assertEquals(1, preview.commits().size());
            assertEquals("agent: feature.txt", preview.commits().get(0).message());
            assertEquals(List.of("feature.txt"), preview.diff().files());
            assertEquals(2, preview.diff().additions());
            assertEquals(List.of("scratch.txt"), preview.uncommittedFiles());
            assertTrue(preview.warnings().stream().anyMatch(w -> w.contains("uncommitted")));
            assertFalse(preview.conflicts().hasConflicts());
            assertEquals(before, repo.revParse("main"));
            assertTrue(backupTags().isEmpty());
        }

        @Test
        @DisplayName("reports code conflicts and an active execution")
        void previewWarnings() throws Exception {
            ExecutionRecord execution = startExecution("exec-1");
            records.save(execution.withStatus(ExecutionStatus.RUNNING));
            commitInWorktree(execution, "src/App.java", "class App {\n    int a = 2;\n}\n");
            repo.write("src/App.java", "class App {\n    int a = 3;\n}\n").commitAll("main edit");

            SyncPreview preview = service.previewSync("exec-1");

            assertFalse(preview.canSync());
            assertEquals(1, preview.conflicts().codeConflicts().size());
            assertEquals(ExecutionStatus.RUNNING, preview.executionStatus());
            assertTrue(preview.warnings().stream().anyMatch(w -> w.contains("active")));
            assertTrue(preview.warnings().stream().anyMatch(w -> w.contains("code conflict")));
        }

        @Test
        @DisplayName("a missing worktree gives a blocked preview rather than an error")
        void blockedPreview() {
            startExecution("exec-1");
            worktrees.removeWorktree("exec-1");

            SyncPreview preview = service.previewSync("exec-1");

            assertFalse(preview.canSync());
            assertEquals(List.of("Worktree no longer exists"), preview.warnings());
            assertEquals("", preview.mergeBase());
        }
    }

    @Test
    @DisplayName("commitMessage pluralizes and falls back for a missing issue")
    void commitMessage() {
        var record = new ExecutionRecord("exec-9", null, ExecutionStatus.COMPLETED, "/tmp/x", "tandem/exec-9",
                "main", null, null);

        String message = WorktreeSyncService.commitMessage(record, 1);

        assertTrue(message.startsWith("Squash merge from tandem/exec-9 (1 commit)\n\n"));
        assertTrue(message.contains("Issue: unknown"));
    }
}
