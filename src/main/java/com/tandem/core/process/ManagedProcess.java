package com.tandem.core.process;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a spawned agent process.
 */
public interface ManagedProcess {

    /** Identifier of this process (pid or synthetic id). */
    String id();

    /**
     * Completes when the process exits. Completes exceptionally if the
     * process could not be observed to the end (e.g. stream failure).
     */
    CompletableFuture<ProcessExit> onExit();

    /** Best-effort termination. Safe to call more than once. */
    void terminate();
}
