package com.tandem.merge;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text containing git conflict markers into clean and conflict sections.
 * diff3-style base sections ({@code |||||||}) are accepted and dropped.
 */
public final class ConflictMarkerParser {

    static final String MARKER_START = "<<<<<<<";
    static final String MARKER_BASE = "|||||||";
    static final String MARKER_MID = "=======";
    static final String MARKER_END = ">>>>>>>";

    private ConflictMarkerParser() {}

    /**
     * @return true only if the opening, separator and closing markers are all present
     */
    public static boolean hasConflictMarkers(String content) {
        if (content == null || content.isEmpty()) {
            return false;
        }
        boolean start = false;
        boolean mid = false;
        boolean end = false;
        for (String line : content.split("\n", -1)) {
            if (line.startsWith(MARKER_START)) {
                start = true;
            } else if (line.startsWith(MARKER_MID) && start) {
                mid = true;
            } else if (line.startsWith(MARKER_END) && mid) {
                end = true;
            }
        }
        return start && mid && end;
    }

    public static List<ConflictSection> parse(String content) {
        var sections = new ArrayList<ConflictSection>();
        if (content == null || content.isEmpty()) {
            return sections;
        }

        List<String> clean = new ArrayList<>();
        List<String> ours = new ArrayList<>();
        List<String> theirs = new ArrayList<>();
        String oursLabel = "";
        int start = -1;
        int middle = -1;
        // 0 = outside, 1 = ours, 2 = base (skipped), 3 = theirs
        int mode = 0;

        String[] lines = content.split("\n", -1);
        int count = lines.length;
        if (content.endsWith("\n")) {
            count--;
        }
        for (int i = 0; i < count; i++) {
            String line = lines[i];
            if (mode == 0 && line.startsWith(MARKER_START)) {
                if (!clean.isEmpty()) {
                    sections.add(ConflictSection.clean(clean));
                    clean = new ArrayList<>();
                }
                ours = new ArrayList<>();
                theirs = new ArrayList<>();
                oursLabel = label(line, MARKER_START);
                start = i;
                mode = 1;
            } else if (mode == 1 && line.startsWith(MARKER_BASE)) {
                mode = 2;
            } else if ((mode == 1 || mode == 2) && line.startsWith(MARKER_MID)) {
                middle = i;
                mode = 3;
            } else if (mode == 3 && line.startsWith(MARKER_END)) {
                sections.add(new ConflictSection(ConflictSection.Type.CONFLICT, List.of(), ours, theirs,
                        oursLabel, label(line, MARKER_END), start, middle, i));
                mode = 0;
            } else if (mode == 0) {
                clean.add(line);
            } else if (mode == 1) {
                ours.add(line);
            } else if (mode == 3) {
                theirs.add(line);
            }
        }

        if (mode != 0) {
            // Unterminated hunk: keep what was read as plain text.
            if (!sections.isEmpty() && !sections.get(sections.size() - 1).isConflict()) {
                clean.addAll(sections.remove(sections.size() - 1).lines());
            }
            clean.addAll(List.of(lines).subList(start, count));
        }
        if (!clean.isEmpty()) {
            sections.add(ConflictSection.clean(clean));
        }
        return sections;
    }

    private static String label(String line, String marker) {
        return line.substring(marker.length()).strip();
    }
}
