package com.tandem.core.process;

/**
 * Thrown when an agent process cannot be started.
 */
public class ProcessSpawnException extends RuntimeException {

    public ProcessSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
