package com.tandem.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task execution and worktree sync.
 */
@Service
public class TandemMetrics {

    private final MeterRegistry registry;

    public TandemMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "completed", "failed" or "cancelled"
     */
    public void recordTaskOutcome(String outcome) {
        Counter.builder("tandem.tasks.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordTaskDuration(Duration duration) {
        Timer.builder("tandem.task.duration")
                .register(registry)
                .record(duration);
    }

    public void recordRetry() {
        Counter.builder("tandem.tasks.retries")
                .description("Task attempts re-queued after a failure")
                .register(registry)
                .increment();
    }

    /**
     * Records one line-merge invocation.
     *
     * @param result "clean", "conflict" or "error"
     */
    public void recordMerge(String result) {
        Counter.builder("tandem.merge.files")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    // --- Sync ---

    /**
     * @param success whether the squash landed
     */
    public void recordSync(boolean success) {
        Counter.builder("tandem.sync.total")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordJsonlResolved(int files) {
        Counter.builder("tandem.sync.jsonl_resolved")
                .description("Structured-log files auto-resolved during sync")
                .register(registry)
                .increment(files);
    }
}
