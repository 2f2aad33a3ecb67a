package com.tandem.worktree;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which files are append-only entity logs that may be merged
 * automatically. Matching is by file name only, at any directory depth.
 */
public class StructuredLogMatcher {

    private final Map<String, String> entityTypesByFileName;

    /**
     * @param entityTypesByFileName file name to entity type, e.g. {@code issues.jsonl -> issue}
     */
    public StructuredLogMatcher(Map<String, String> entityTypesByFileName) {
        this.entityTypesByFileName = new LinkedHashMap<>(entityTypesByFileName);
    }

    public static StructuredLogMatcher defaults() {
        var map = new LinkedHashMap<String, String>();
        map.put("issues.jsonl", "issue");
        map.put("specs.jsonl", "spec");
        return new StructuredLogMatcher(map);
    }

    /**
     * @return the entity type if the path names a structured log, else empty
     */
    public Optional<String> entityType(String path) {
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        String normalized = path.replace('\\', '/');
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        return Optional.ofNullable(entityTypesByFileName.get(fileName));
    }

    public boolean matches(String path) {
        return entityType(path).isPresent();
    }
}
