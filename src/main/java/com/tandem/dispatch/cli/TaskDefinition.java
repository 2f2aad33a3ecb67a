package com.tandem.dispatch.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskConfig;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * One entry of a task file read by {@code tandem run}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskDefinition(
    String id,
    String type,
    String prompt,
    String workDir,
    Integer priority,
    List<String> dependencies,
    Integer maxRetries,
    Long timeoutSeconds,
    Map<String, String> env
) {

    public Task toTask(String defaultWorkDir) {
        var config = new TaskConfig(maxRetries,
                timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : null, env);
        return new Task(id,
                type != null ? type : "custom",
                prompt,
                workDir != null ? workDir : defaultWorkDir,
                priority != null ? priority : 0,
                dependencies != null ? new LinkedHashSet<>(dependencies) : null,
                config,
                null);
    }
}
