package com.tandem.sync;

/**
 * Persisted state of one agent execution.
 *
 * @param id           execution id
 * @param issueId      issue the execution works on, may be null
 * @param status       lifecycle status
 * @param worktreePath isolated checkout, null if none was created
 * @param branchName   execution branch
 * @param targetBranch branch the execution syncs into
 * @param streamId     id of the output stream of the agent, may be null
 * @param afterCommit  commit produced by the last successful sync, may be null
 */
public record ExecutionRecord(
    String id,
    String issueId,
    ExecutionStatus status,
    String worktreePath,
    String branchName,
    String targetBranch,
    String streamId,
    String afterCommit
) {

    public ExecutionRecord withStatus(ExecutionStatus newStatus) {
        return new ExecutionRecord(id, issueId, newStatus, worktreePath, branchName, targetBranch, streamId, afterCommit);
    }

    public ExecutionRecord withAfterCommit(String commit) {
        return new ExecutionRecord(id, issueId, status, worktreePath, branchName, targetBranch, streamId, commit);
    }
}
