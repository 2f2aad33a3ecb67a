package com.tandem.core.engine;

import com.tandem.core.events.EventBus;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.process.ProcessSpawner;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds engines sharing one spawner and the configured defaults. Each engine
 * owns its worker pool; callers shut it down when done.
 */
public class ExecutionEngineFactory {

    private final ProcessSpawner spawner;
    private final int defaultMaxConcurrent;
    private final int defaultMaxRetries;
    private final int workerThreads;
    private final EventBus eventBus;
    private final TandemMetrics metrics;

    public ExecutionEngineFactory(ProcessSpawner spawner, int defaultMaxConcurrent, int defaultMaxRetries,
                                  int workerThreads, EventBus eventBus, TandemMetrics metrics) {
        this.spawner = spawner;
        this.defaultMaxConcurrent = defaultMaxConcurrent;
        this.defaultMaxRetries = defaultMaxRetries;
        this.workerThreads = Math.max(1, workerThreads);
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public ExecutionEngine create() {
        return create(defaultMaxConcurrent);
    }

    public ExecutionEngine create(int maxConcurrent) {
        return new SimpleExecutionEngine(spawner, maxConcurrent, defaultMaxRetries,
                Executors.newFixedThreadPool(workerThreads, daemonThreads("tandem-worker-")), eventBus, metrics);
    }

    static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
