package com.docassets.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link BuildLogger}.
 * Checks the line format, debug gating and the aggregation of recurring warnings.
 */
class BuildLoggerTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        // Drop counters left over from other tests before pointing at the temp dir
        BuildLogger.configure(null, false);
        BuildLogger.flush();
        BuildLogger.configure(tempDir, false);
    }

    @AfterEach
    void tearDown() {
        BuildLogger.setDebugEnabled(false);
        BuildLogger.configure(null, true);
    }

    @Test
    void testLogInfo_ShouldAppendFormattedLine() throws IOException {
        BuildLogger.logInfo("AssetDiscovery", "Discovered 3 assets");

        Path logFile = BuildLogger.getLogFile();
        assertEquals(tempDir.resolve(".doc-assets").resolve("build.log"), logFile);
        String content = Files.readString(logFile);
        assertTrue(content.matches("(?s)\\[\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}] \\[INFO] \\[AssetDiscovery] Discovered 3 assets.*"),
                "Unexpected log line: " + content);
    }

    @Test
    void testLogDebug_DisabledByDefault_ShouldWriteNothing() {
        BuildLogger.logDebug("AssetProcessor", "hidden");

        assertFalse(Files.exists(BuildLogger.getLogFile()));
    }

    @Test
    void testLogDebug_WhenEnabled_ShouldWrite() throws IOException {
        BuildLogger.setDebugEnabled(true);
        BuildLogger.logDebug("AssetProcessor", "visible");

        assertTrue(Files.readString(BuildLogger.getLogFile()).contains("[DEBUG] [AssetProcessor] visible"));
    }

    @Test
    void testLogError_ShouldIncludeStackTrace() throws IOException {
        BuildLogger.logError("AssetPublisher", "copy failed", new IOException("disk full"));

        String content = Files.readString(BuildLogger.getLogFile());
        assertTrue(content.contains("[ERROR] [AssetPublisher] copy failed"));
        assertTrue(content.contains("java.io.IOException: disk full"));
    }

    /**
     * Identical recurring warnings are written once and summarized on flush.
     */
    @Test
    void testLogRecurringWarning_ShouldAggregateDuplicates() throws IOException {
        for (int i = 0; i < 3; i++) {
            BuildLogger.logRecurringWarning("ImageOptimizer", "AVIF conversion skipped", null);
        }
        BuildLogger.flush();

        String content = Files.readString(BuildLogger.getLogFile());
        assertEquals(1, countOccurrences(content, "[WARN] [ImageOptimizer] AVIF conversion skipped"));
        assertTrue(content.contains("occurred 2 additional times: [ImageOptimizer] AVIF conversion skipped"));
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int index = text.indexOf(needle);
        while (index >= 0) {
            count++;
            index = text.indexOf(needle, index + needle.length());
        }
        return count;
    }
}
