package com.tandem.worktree;

import java.util.ArrayList;
import java.util.List;

/**
 * Files that conflict between two branches, split by whether they can be
 * resolved automatically.
 */
public record ConflictReport(
    boolean hasConflicts,
    List<JsonlConflict> jsonlConflicts,
    List<CodeConflict> codeConflicts,
    int totalFiles,
    String summary
) {

    public ConflictReport {
        jsonlConflicts = List.copyOf(jsonlConflicts);
        codeConflicts = List.copyOf(codeConflicts);
    }

    public static ConflictReport of(List<JsonlConflict> jsonlConflicts, List<CodeConflict> codeConflicts) {
        int total = jsonlConflicts.size() + codeConflicts.size();
        return new ConflictReport(total > 0, jsonlConflicts, codeConflicts, total,
                summarize(jsonlConflicts.size(), codeConflicts.size()));
    }

    public static ConflictReport none() {
        return of(List.of(), List.of());
    }

    public boolean hasCodeConflicts() {
        return !codeConflicts.isEmpty();
    }

    static String summarize(int jsonl, int code) {
        if (jsonl == 0 && code == 0) {
            return "No conflicts detected";
        }
        var parts = new ArrayList<String>();
        if (jsonl > 0) {
            parts.add("%d JSONL conflict%s (auto-resolvable)".formatted(jsonl, jsonl == 1 ? "" : "s"));
        }
        if (code > 0) {
            parts.add("%d code conflict%s (requires manual resolution)".formatted(code, code == 1 ? "" : "s"));
        }
        return String.join(", ", parts);
    }
}
