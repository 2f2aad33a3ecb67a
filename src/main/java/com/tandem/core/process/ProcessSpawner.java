package com.tandem.core.process;

import com.tandem.core.model.Task;

/**
 * Abstraction for starting the agent process that carries out a task.
 * Implementations: CommandProcessSpawner (local executable); tests supply fakes.
 *
 * <p>The engine owns scheduling only. Output streaming, PTYs and output
 * normalization belong to the implementation, not to the caller.
 */
public interface ProcessSpawner {

    /**
     * Starts a process for one attempt of a task.
     *
     * @param task    the task to run
     * @param attempt 1-based attempt number
     * @return a handle to the started process
     * @throws ProcessSpawnException if the process cannot be started
     */
    ManagedProcess spawn(Task task, int attempt);
}
