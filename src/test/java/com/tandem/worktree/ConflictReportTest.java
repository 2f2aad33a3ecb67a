package com.tandem.worktree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConflictReportTest {

    private static final JsonlConflict ISSUES = new JsonlConflict("issues.jsonl", "issue");
    private static final CodeConflict MAIN = new CodeConflict("Main.java", ConflictType.CONTENT, "d", "s");

    @Test
    @DisplayName("an empty report has the fixed summary")
    void emptyReport() {
        ConflictReport report = ConflictReport.none();

        assertFalse(report.hasConflicts());
        assertEquals(0, report.totalFiles());
        assertEquals("No conflicts detected", report.summary());
    }

    @Test
    @DisplayName("summary pluralizes counts")
    void pluralizes() {
        assertEquals("1 code conflict (requires manual resolution)",
                ConflictReport.of(List.of(), List.of(MAIN)).summary());
        assertEquals("2 code conflicts (requires manual resolution)",
                ConflictReport.of(List.of(), List.of(MAIN, MAIN)).summary());
        assertEquals("2 JSONL conflicts (auto-resolvable)",
                ConflictReport.of(List.of(ISSUES, ISSUES), List.of()).summary());
    }

    @Test
    @DisplayName("mixed reports mention both kinds")
    void mixedSummary() {
        ConflictReport report = ConflictReport.of(List.of(ISSUES), List.of(MAIN, MAIN));

        assertTrue(report.hasConflicts());
        assertTrue(report.hasCodeConflicts());
        assertEquals(3, report.totalFiles());
        assertEquals("1 JSONL conflict (auto-resolvable), 2 code conflicts (requires manual resolution)",
                report.summary());
    }

    @Test
    @DisplayName("only code conflicts need manual resolution")
    void autoResolveFlags() {
        assertTrue(ISSUES.canAutoResolve());
        assertFalse(MAIN.canAutoResolve());
    }
}
