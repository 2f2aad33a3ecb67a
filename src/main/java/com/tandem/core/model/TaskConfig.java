package com.tandem.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.Map;

/**
 * Per-task execution settings.
 *
 * @param maxRetries additional attempts allowed after the first one; {@code null} uses the engine default
 * @param timeout    wall-clock limit for a single attempt; {@code null} means no limit
 * @param env        extra environment variables for the spawned process
 */
public record TaskConfig(
    Integer maxRetries,
    Duration timeout,
    Map<String, String> env
) implements Serializable {

    public TaskConfig {
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static TaskConfig defaults() {
        return new TaskConfig(null, null, Map.of());
    }

    public static TaskConfig withRetries(int maxRetries) {
        return new TaskConfig(maxRetries, null, Map.of());
    }
}
