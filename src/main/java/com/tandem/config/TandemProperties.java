package com.tandem.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "tandem")
public class TandemProperties {

    private String repoPath = ".";
    private Git git = new Git();
    private Engine engine = new Engine();
    private Agent agent = new Agent();
    private Sync sync = new Sync();
    private Worktree worktree = new Worktree();
    private Store store = new Store();

    // -- Flattened accessors (delegate to nested) --
    public String getGitExecutable() { return git.executable; }
    public int getMaxConcurrent() { return engine.maxConcurrent; }
    public int getDefaultMaxRetries() { return engine.defaultMaxRetries; }
    public int getWorkerThreads() { return engine.workerThreads; }
    public List<String> getAgentCommand() { return agent.command; }
    public String getBackupTagPrefix() { return sync.backupTagPrefix; }
    public Map<String, String> getStructuredLogs() { return sync.structuredLogs; }
    public String getWorktreeRoot() { return worktree.root; }
    public String getBranchPrefix() { return worktree.branchPrefix; }
    public String getStorePath() { return store.path; }

    public String getRepoPath() { return repoPath; }
    public void setRepoPath(String repoPath) { this.repoPath = repoPath; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Sync getSync() { return sync; }
    public void setSync(Sync sync) { this.sync = sync; }
    public Worktree getWorktree() { return worktree; }
    public void setWorktree(Worktree worktree) { this.worktree = worktree; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public static class Git {
        private String executable = "git";

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
    }

    public static class Engine {
        private int maxConcurrent = 3;
        private int defaultMaxRetries = 0;
        private int workerThreads = 8;

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
        public int getDefaultMaxRetries() { return defaultMaxRetries; }
        public void setDefaultMaxRetries(int defaultMaxRetries) { this.defaultMaxRetries = defaultMaxRetries; }
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    public static class Agent {
        private List<String> command = new ArrayList<>(List.of("claude", "--print", "--output-format", "stream-json"));

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
    }

    public static class Sync {
        private String backupTagPrefix = "tandem-sync-before-";
        private Map<String, String> structuredLogs = new LinkedHashMap<>(Map.of(
                "issues.jsonl", "issue",
                "specs.jsonl", "spec"));

        public String getBackupTagPrefix() { return backupTagPrefix; }
        public void setBackupTagPrefix(String backupTagPrefix) { this.backupTagPrefix = backupTagPrefix; }
        public Map<String, String> getStructuredLogs() { return structuredLogs; }
        public void setStructuredLogs(Map<String, String> structuredLogs) { this.structuredLogs = structuredLogs; }
    }

    public static class Worktree {
        private String root = ".tandem/worktrees";
        private String branchPrefix = "tandem/";

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
    }

    public static class Store {
        private String path = ".tandem/executions.json";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }
}
