package com.tandem.core.engine;

import com.tandem.config.TandemProperties;
import com.tandem.core.events.EventBus;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.process.CommandProcessSpawner;
import com.tandem.core.process.ProcessSpawner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EngineConfig {

    /**
     * Threads that drain agent stdout/stderr. Unbounded because every live
     * process holds two of them for its whole lifetime.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService processStreamExecutor() {
        return Executors.newCachedThreadPool(ExecutionEngineFactory.daemonThreads("tandem-stream-"));
    }

    @Bean
    public ProcessSpawner processSpawner(TandemProperties properties,
                                         @Qualifier("processStreamExecutor") ExecutorService processStreamExecutor) {
        return new CommandProcessSpawner(properties.getAgentCommand(), processStreamExecutor);
    }

    @Bean
    public ExecutionEngineFactory executionEngineFactory(ProcessSpawner processSpawner,
                                                         TandemProperties properties,
                                                         EventBus eventBus,
                                                         @Autowired(required = false) TandemMetrics metrics) {
        return new ExecutionEngineFactory(processSpawner, properties.getMaxConcurrent(),
                properties.getDefaultMaxRetries(), properties.getWorkerThreads(), eventBus, metrics);
    }
}
