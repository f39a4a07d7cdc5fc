package com.docassets.util;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe build logger. Writes to {@code <outputRoot>/.doc-assets/build.log}
 * once {@link #configure(Path, boolean)} has been called, and mirrors every line
 * to the console unless console output is switched off.
 * Synchronized to prevent file corruption during concurrent access by workers.
 * Includes log rotation and aggregation of recurring warnings.
 */
public class BuildLogger {

    private static final Object LOCK = new Object();
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String LOG_DIR_NAME = ".doc-assets";
    private static final String LOG_FILE_NAME = "build.log";
    private static final String OLD_LOG_FILE_NAME = "build.log.old";
    private static final long MAX_LOG_SIZE_BYTES = 5 * 1024 * 1024; // 5 MB

    private static volatile Path logDir;
    private static volatile boolean logDirInitialized;
    private static volatile boolean consoleEnabled = true;
    private static volatile boolean debugEnabled;

    // Signature -> occurrence count, for warnings that repeat once per asset
    private static final Map<String, AtomicInteger> AGGREGATED = new ConcurrentHashMap<>();

    private BuildLogger() {
    }

    /**
     * Directs file output to the given output root. A null root keeps console output only.
     *
     * @param outputRoot     directory that receives the {@code .doc-assets} log folder
     * @param consoleEnabled whether lines are mirrored to stdout/stderr
     */
    public static void configure(Path outputRoot, boolean consoleEnabled) {
        synchronized (LOCK) {
            BuildLogger.logDir = outputRoot == null ? null : outputRoot.resolve(LOG_DIR_NAME);
            BuildLogger.logDirInitialized = false;
            BuildLogger.consoleEnabled = consoleEnabled;
        }
    }

    public static void setDebugEnabled(boolean enabled) {
        debugEnabled = enabled;
    }

    public static boolean isDebugEnabled() {
        return debugEnabled;
    }

    /**
     * @return the log file currently written to, or null when file logging is off.
     */
    public static Path getLogFile() {
        Path dir = logDir;
        return dir == null ? null : dir.resolve(LOG_FILE_NAME);
    }

    public static void logInfo(String context, String message) {
        writeLog("INFO", context, message, null);
    }

    /**
     * Logs only when debug output is enabled (the CLI's --verbose).
     */
    public static void logDebug(String context, String message) {
        if (debugEnabled) {
            writeLog("DEBUG", context, message, null);
        }
    }

    public static void logWarning(String context, String message, Throwable error) {
        writeLog("WARN", context, message, error);
    }

    public static void logError(String context, String message, Throwable error) {
        writeLog("ERROR", context, message, error);
    }

    /**
     * Logs a recurring warning. The first occurrence is logged immediately;
     * identical ones (same context, message, and exception type) are only counted
     * and summarized by {@link #flush()}.
     */
    public static void logRecurringWarning(String context, String message, Throwable error) {
        String signature = generateSignature(context, message, error);
        AtomicInteger counter = AGGREGATED.computeIfAbsent(signature, k -> new AtomicInteger(0));
        if (counter.getAndIncrement() == 0) {
            writeLog("WARN", context, message, error);
        }
    }

    /**
     * Writes a summary line for every recurring warning seen more than once since the last flush.
     */
    public static void flush() {
        Map<String, Integer> snapshot = new TreeMap<>();
        AGGREGATED.forEach((signature, count) -> snapshot.put(signature, count.get()));
        AGGREGATED.clear();

        snapshot.forEach((signature, total) -> {
            if (total > 1) {
                writeLog("SUMMARY", "WarningAggregation",
                        String.format("The following warning occurred %d additional times: %s", total - 1, signature), null);
            }
        });
    }

    private static String generateSignature(String context, String message, Throwable error) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(context).append("] ").append(message);
        if (error != null) {
            sb.append(" | ").append(error.getClass().getName());
        }
        return sb.toString();
    }

    private static void writeLog(String level, String context, String message, Throwable error) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(LocalDateTime.now().format(DATE_FORMAT)).append("] ");
        sb.append("[").append(level).append("] ");
        sb.append("[").append(context).append("] ");
        sb.append(message);
        String head = sb.toString();

        if (error != null) {
            sb.append(System.lineSeparator());
            StringWriter sw = new StringWriter();
            error.printStackTrace(new PrintWriter(sw));
            sb.append(sw);
        }
        String line = sb.toString();

        synchronized (LOCK) {
            if (consoleEnabled) {
                PrintStream out = ("ERROR".equals(level) || "WARN".equals(level)) ? System.err : System.out;
                out.println(error != null && !debugEnabled ? head + " (" + error + ")" : line);
            }

            Path dir = logDir;
            if (dir == null) {
                return;
            }
            try {
                if (!logDirInitialized) {
                    Files.createDirectories(dir);
                    logDirInitialized = true;
                }

                Path logFile = dir.resolve(LOG_FILE_NAME);

                // Log rotation
                if (Files.exists(logFile) && Files.size(logFile) > MAX_LOG_SIZE_BYTES) {
                    Files.move(logFile, dir.resolve(OLD_LOG_FILE_NAME), StandardCopyOption.REPLACE_EXISTING);
                }

                Files.writeString(
                        logFile,
                        line + System.lineSeparator(),
                        StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND,
                        StandardOpenOption.WRITE
                );
            } catch (IOException e) {
                // Fallback to console if file writing fails
                System.err.println("CRITICAL: Unable to write to build log " + dir + ": " + e.getMessage());
            }
        }
    }
}
