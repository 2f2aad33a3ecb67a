package com.tandem.sync;

import java.util.List;

/**
 * Files touched between two revisions with line counts. Binary files count zero lines.
 */
public record DiffSummary(List<String> files, int additions, int deletions) {

    public DiffSummary {
        files = List.copyOf(files);
    }

    public static DiffSummary empty() {
        return new DiffSummary(List.of(), 0, 0);
    }
}
