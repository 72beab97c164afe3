package com.prrules.analyzer.orchestrator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command line parsing of {@link AnalyzerApp}.
 */
class AnalyzerAppTest {

    @Test
    @DisplayName("Repository arguments select collection")
    void parse_repositories() {
        AnalyzerApp.Command command = AnalyzerApp.parseArgs(new String[]{"octo/repo", "acme/widgets"});

        assertEquals(AnalyzerApp.Mode.COLLECT, command.mode());
        assertEquals(List.of("octo/repo", "acme/widgets"), command.repositories());
    }

    @Test
    @DisplayName("--status and --cleanup select their modes")
    void parse_flags() {
        assertEquals(AnalyzerApp.Mode.STATUS, AnalyzerApp.parseArgs(new String[]{"--status"}).mode());

        AnalyzerApp.Command cleanup = AnalyzerApp.parseArgs(new String[]{"--cleanup", "30"});
        assertEquals(AnalyzerApp.Mode.CLEANUP, cleanup.mode());
        assertEquals(30, cleanup.cleanupDays());
    }

    @Test
    @DisplayName("Rejects missing, malformed and negative arguments")
    void parse_invalid() {
        assertThrows(IllegalArgumentException.class, () -> AnalyzerApp.parseArgs(new String[]{}));
        assertThrows(IllegalArgumentException.class, () -> AnalyzerApp.parseArgs(new String[]{"--cleanup"}));
        assertThrows(IllegalArgumentException.class, () -> AnalyzerApp.parseArgs(new String[]{"--cleanup", "soon"}));
        assertThrows(IllegalArgumentException.class, () -> AnalyzerApp.parseArgs(new String[]{"--cleanup", "-1"}));
        assertThrows(IllegalArgumentException.class, () -> AnalyzerApp.parseArgs(new String[]{"repo-only"}));
        assertThrows(IllegalArgumentException.class, () -> AnalyzerApp.parseArgs(new String[]{"a/b/c"}));
        assertThrows(IllegalArgumentException.class, () -> AnalyzerApp.parseArgs(new String[]{"/repo"}));
    }
}
