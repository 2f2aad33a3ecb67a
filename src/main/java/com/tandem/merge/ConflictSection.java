package com.tandem.merge;

import java.util.List;

/**
 * One contiguous run of a file that may contain conflict markers: either
 * clean lines or a single conflict hunk.
 *
 * @param type        CLEAN or CONFLICT
 * @param lines       clean lines (CLEAN only, otherwise empty)
 * @param ours        lines between {@code <<<<<<<} and {@code =======} (CONFLICT only)
 * @param theirs      lines between {@code =======} and {@code >>>>>>>} (CONFLICT only)
 * @param oursLabel   label after {@code <<<<<<<}, may be empty
 * @param theirsLabel label after {@code >>>>>>>}, may be empty
 * @param startLine   0-based line of the opening marker (CONFLICT only, else -1)
 * @param middleLine  0-based line of the separator (CONFLICT only, else -1)
 * @param endLine     0-based line of the closing marker (CONFLICT only, else -1)
 */
public record ConflictSection(
    Type type,
    List<String> lines,
    List<String> ours,
    List<String> theirs,
    String oursLabel,
    String theirsLabel,
    int startLine,
    int middleLine,
    int endLine
) {

    public enum Type { CLEAN, CONFLICT }

    public ConflictSection {
        lines = List.copyOf(lines);
        ours = List.copyOf(ours);
        theirs = List.copyOf(theirs);
    }

    static ConflictSection clean(List<String> lines) {
        return new ConflictSection(Type.CLEAN, lines, List.of(), List.of(), "", "", -1, -1, -1);
    }

    public boolean isConflict() {
        return type == Type.CONFLICT;
    }
}
