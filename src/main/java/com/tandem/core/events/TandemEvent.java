package com.tandem.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event emitted by the execution engine or the worktree synchronizer.
 *
 * @param eventType event type (e.g. "task.started", "task.failed", "sync.completed")
 * @param subjectId the task id or execution id the event belongs to
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record TandemEvent(
    String eventType,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static TandemEvent of(String eventType, String subjectId, Map<String, Object> payload) {
        return new TandemEvent(eventType, subjectId, payload == null ? Map.of() : payload, Instant.now());
    }
}
