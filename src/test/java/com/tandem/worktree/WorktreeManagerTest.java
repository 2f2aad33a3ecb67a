package com.tandem.worktree;

import com.tandem.support.GitTestRepo;
import com.tandem.worktree.WorktreeManager.WorktreeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class WorktreeManagerTest {

    @TempDir
    Path dir;

    private GitTestRepo repo;
    private WorktreeManager manager;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(GitTestRepo.gitAvailable(), "git not installed");
        repo = GitTestRepo.init(dir);
        manager = new WorktreeManager(repo.cli(), dir, Path.of(".tandem/worktrees"), "tandem/");
    }

    @Test
    @DisplayName("names branches and paths after the execution id")
    void naming() {
        assertEquals("tandem/exec-1", manager.getBranchName("exec-1"));
        assertEquals(dir.resolve(".tandem/worktrees/exec-1"), manager.getWorktreePath("exec-1"));
    }

    @Test
    @DisplayName("creates a worktree on a new branch cut from the target")
    void createsWorktree() throws Exception {
        WorktreeResult result = manager.createWorktree("exec-1", "main");

        assertTrue(result.success(), result.error());
        assertEquals("tandem/exec-1", result.branchName());
        assertTrue(Files.isRegularFile(result.worktreePath().resolve("README.md")));
        assertEquals(repo.revParse("main"), repo.revParse("tandem/exec-1"));
        assertEquals(result.worktreePath(), manager.getActiveWorktrees().get("exec-1"));
    }

    @Test
    @DisplayName("creating twice reuses the existing worktree")
    void reusesWorktree() {
        WorktreeResult first = manager.createWorktree("exec-1", "main");
        WorktreeResult second = manager.createWorktree("exec-1", "main");

        assertTrue(second.success());
        assertEquals(first.worktreePath(), second.worktreePath());
    }

    @Test
    @DisplayName("commitAll commits changes and reports when there is nothing to commit")
    void commitAll() throws Exception {
        Path worktree = manager.createWorktree("exec-1", "main").worktreePath();
        Files.writeString(worktree.resolve("work.txt"), "done\n");

        assertTrue(manager.commitAll(worktree, "agent work"));
        assertFalse(manager.commitAll(worktree, "nothing"));
        assertEquals("agent work", repo.git("log", "-1", "--format=%s", "tandem/exec-1"));
    }

    @Test
    @DisplayName("removing a worktree keeps its branch, and it can be recreated from that branch")
    void removeKeepsBranch() throws Exception {
        Path worktree = manager.createWorktree("exec-1", "main").worktreePath();
        Files.writeString(worktree.resolve("work.txt"), "done\n");
        manager.commitAll(worktree, "agent work");
        String branchHead = repo.revParse("tandem/exec-1");

        assertTrue(manager.removeWorktree("exec-1"));
        assertFalse(Files.exists(worktree));
        assertEquals(branchHead, repo.revParse("tandem/exec-1"));

        WorktreeResult again = manager.createWorktree("exec-1", "main");
        assertTrue(again.success(), again.error());
        assertTrue(Files.exists(again.worktreePath().resolve("work.txt")));
    }

    @Test
    @DisplayName("removing an unknown worktree is a no-op")
    void removeUnknown() {
        assertTrue(manager.removeWorktree("never-created"));
    }

    @Test
    @DisplayName("an unknown target branch fails with a message")
    void unknownTarget() {
        WorktreeResult result = manager.createWorktree("exec-1", "no-such-branch");

        assertFalse(result.success());
        assertNotNull(result.error());
    }
}
