package com.docassets.service;

import com.docassets.exception.PathSecurityException;
import com.docassets.model.ValidationResult;
import com.docassets.util.BuildLogger;
import com.docassets.util.FileUtils;
import com.docassets.util.MimeTypes;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Pattern;

/**
 * Security checks for asset files: type allow-listing, path sanitization, size
 * limits and a scan of the leading bytes for executables, scripts, injection
 * markers and spoofed image signatures.
 * All checks only read the filesystem.
 */
public class SecurityValidator {

    private static final int SCAN_BUFFER_SIZE = 1024; // 1KB
    private static final int TEXT_SCAN_LENGTH = 512;

    private static final byte[][] EXECUTABLE_SIGNATURES = {
            {0x4D, 0x5A},                                       // PE/DOS (MZ)
            {0x7F, 0x45, 0x4C, 0x46},                           // ELF
            {(byte) 0xFE, (byte) 0xED, (byte) 0xFA, (byte) 0xCE}, // Mach-O 32-bit
            {(byte) 0xFE, (byte) 0xED, (byte) 0xFA, (byte) 0xCF}, // Mach-O 64-bit
            {(byte) 0xCA, (byte) 0xFE, (byte) 0xBA, (byte) 0xBE}, // Java class
    };

    private static final Map<String, byte[][]> IMAGE_SIGNATURES = Map.of(
            "jpg", new byte[][]{{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}},
            "jpeg", new byte[][]{{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}},
            "png", new byte[][]{{(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A}},
            "gif", new byte[][]{
                    {0x47, 0x49, 0x46, 0x38, 0x37, 0x61}, // GIF87a
                    {0x47, 0x49, 0x46, 0x38, 0x39, 0x61}  // GIF89a
            },
            "webp", new byte[][]{{0x52, 0x49, 0x46, 0x46}} // RIFF container
    );

    private static final Set<String> SCRIPT_EXTENSIONS = Set.of("js", "ts", "py", "sh", "bat", "ps1");

    private static final List<Pattern> SCRIPT_PATTERNS = List.of(
            Pattern.compile("<script[^>]*>", Pattern.CASE_INSENSITIVE),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("vbscript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bon[a-z]+\\s*=", Pattern.CASE_INSENSITIVE), // Event handlers
            Pattern.compile("eval\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("document\\.write", Pattern.CASE_INSENSITIVE),
            Pattern.compile("window\\.location", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.innerHTML", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("\\$\\{.*\\}"),                       // Template injection
            Pattern.compile("<\\?php", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<%.*%>"),                            // ASP/JSP
            Pattern.compile("\\{\\{.*\\}\\}"),                    // Template engines
            Pattern.compile("\\bexec\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bsystem\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bshell_exec\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bpassthru\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bfile_get_contents\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bfopen\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\binclude\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\brequire\\s*\\(", Pattern.CASE_INSENSITIVE)
    );

    private static final List<String> SENSITIVE_PREFIXES = List.of(
            "/etc/", "/proc/", "/sys/", "/dev/", "/var/log/", "/root/"
    );

    private static final Pattern HIDDEN_HOME_FILE = Pattern.compile("^/home/[^/]+/\\.[^/]+");
    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[a-zA-Z]:/?");

    private final SecurityOptions options;

    public SecurityValidator() {
        this(SecurityOptions.defaults());
    }

    public SecurityValidator(SecurityOptions options) {
        this.options = options;
    }

    public SecurityOptions getOptions() {
        return options;
    }

    /**
     * Checks the MIME type derived from the file extension against the combined allow-list.
     */
    public boolean validateFileType(Path file) {
        String mimeType = MimeTypes.getMimeType(String.valueOf(file.getFileName()));
        return options.getAllowedImageTypes().contains(mimeType)
                || options.getAllowedBinaryTypes().contains(mimeType);
    }

    /**
     * Sanitizes a path using the configured strictness.
     *
     * @see #sanitizePath(String, boolean)
     */
    public String sanitizePath(String inputPath) {
        return sanitizePath(inputPath, options.isStrictPathValidation());
    }

    /**
     * Normalizes separators, drops "." segments and strips leading "./", "/" and drive prefixes.
     * In strict mode, traversal and injection attempts are rejected; in lenient mode the
     * dangerous segments are removed instead.
     *
     * @param inputPath the path to clean
     * @param strict    reject rather than repair dangerous paths
     * @return a relative, '/' separated path
     * @throws PathSecurityException in strict mode, for "..", "~" segments, null bytes or
     *                               sensitive system directories
     */
    public String sanitizePath(String inputPath, boolean strict) {
        if (inputPath == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        String normalized = normalize(inputPath);

        if (strict) {
            validatePathSecurity(inputPath, normalized);
        } else {
            normalized = stripDangerousSegments(normalized);
        }

        String relative = normalized;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        return DRIVE_PREFIX.matcher(relative).replaceFirst("");
    }

    /**
     * @return false when the file is larger than the configured maximum or cannot be stat'ed.
     */
    public boolean checkFileSize(Path file) {
        try {
            return Files.size(file) <= options.getMaxFileSize();
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Scans the first kilobyte of a file.
     *
     * @return true when the content looks safe (or scanning is disabled), false when it is
     * suspicious or cannot be read
     */
    public boolean scanForMaliciousContent(Path file) {
        if (!options.isContentScanningEnabled()) {
            return true;
        }

        byte[] content;
        try (InputStream in = Files.newInputStream(file)) {
            content = in.readNBytes(SCAN_BUFFER_SIZE);
        } catch (IOException e) {
            // An unreadable file is treated as suspicious
            BuildLogger.logDebug("SecurityValidator", "Unable to read " + file + " for scanning: " + e.getMessage());
            return false;
        }

        return analyzeFileContent(content, String.valueOf(file.getFileName()));
    }

    /**
     * Runs every check against one file.
     *
     * @see #validateAsset(Path, String)
     */
    public ValidationResult validateAsset(Path file) {
        return validateAsset(file, file == null ? "null" : file.toString());
    }

    /**
     * Runs existence, type, size, path and content checks against one file. Never throws
     * for ordinary failures; they are recorded as errors.
     *
     * @param file        the file to read
     * @param logicalPath the path subjected to sanitization, usually its path inside the content tree
     */
    public ValidationResult validateAsset(Path file, String logicalPath) {
        ValidationResult result = new ValidationResult();

        try {
            if (file == null || !Files.exists(file)) {
                result.addError("File does not exist: " + logicalPath);
                return result;
            }
            if (!Files.isRegularFile(file)) {
                result.addError("Not a regular file: " + logicalPath);
                return result;
            }

            if (!validateFileType(file)) {
                result.addError("File type not allowed: " + MimeTypes.getMimeType(String.valueOf(file.getFileName())));
            }

            if (!checkFileSize(file)) {
                result.addError(describeSizeFailure(file));
            }

            try {
                String sanitizedPath = sanitizePath(logicalPath);
                if (!sanitizedPath.equals(logicalPath)) {
                    result.addWarning("Path was sanitized from " + logicalPath + " to " + sanitizedPath);
                    result.setSanitizedPath(sanitizedPath);
                }
            } catch (PathSecurityException e) {
                result.addError("Path validation failed: " + e.getMessage());
            }

            // Content scanning only makes sense for files that passed everything else
            if (result.isValid() && !scanForMaliciousContent(file)) {
                result.addError("File content appears to be malicious or suspicious");
            }
        } catch (RuntimeException e) {
            result.addError("Validation error: " + e.getMessage());
        }

        if (!result.isValid()) {
            BuildLogger.logDebug("SecurityValidator", "Rejected " + logicalPath + ": " + result.getErrors());
        }
        return result;
    }

    /**
     * Validates many files independently and in parallel. Never throws: every input path
     * gets its own result, in input order.
     */
    public Map<Path, ValidationResult> validateAssets(List<Path> files) {
        Map<String, Path> byLogicalPath = new LinkedHashMap<>();
        for (Path file : files) {
            byLogicalPath.put(String.valueOf(file), file);
        }
        Map<String, ValidationResult> results = validateAll(byLogicalPath);

        Map<Path, ValidationResult> byPath = new LinkedHashMap<>();
        for (Path file : files) {
            byPath.put(file, results.get(String.valueOf(file)));
        }
        return byPath;
    }

    /**
     * Parallel validation keyed by logical path.
     *
     * @param files logical path (sanitization subject) mapped to the file to read
     * @return one result per key, in input order
     */
    public Map<String, ValidationResult> validateAll(Map<String, Path> files) {
        Map<String, ValidationResult> results = new LinkedHashMap<>();
        if (files.isEmpty()) {
            return results;
        }

        int threads = Math.min(options.getWorkerThreads(), files.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            Map<String, Future<ValidationResult>> futures = new LinkedHashMap<>();
            files.forEach((logicalPath, file) ->
                    futures.put(logicalPath, executor.submit(() -> validateAsset(file, logicalPath))));

            for (Map.Entry<String, Future<ValidationResult>> entry : futures.entrySet()) {
                results.put(entry.getKey(), awaitResult(entry.getKey(), entry.getValue()));
            }
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    private ValidationResult awaitResult(String logicalPath, Future<ValidationResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            BuildLogger.logError("SecurityValidator", "Unexpected failure validating " + logicalPath, cause);
            return ValidationResult.failure("Validation error: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ValidationResult.failure("Validation interrupted: " + logicalPath);
        }
    }

    private String describeSizeFailure(Path file) {
        try {
            return "File size exceeds maximum allowed size (" + options.getMaxFileSize() + " bytes): "
                    + Files.size(file) + " bytes";
        } catch (IOException e) {
            return "Unable to determine file size: " + e.getMessage();
        }
    }

    private static String normalize(String inputPath) {
        String path = FileUtils.toForwardSlashes(inputPath);
        boolean absolute = path.startsWith("/");
        List<String> kept = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) continue;
            kept.add(segment);
        }
        return (absolute ? "/" : "") + String.join("/", kept);
    }

    private static void validatePathSecurity(String inputPath, String normalized) {
        if (inputPath.indexOf('\0') >= 0) {
            throw new PathSecurityException("Null byte in path detected: " + printable(inputPath), printable(inputPath));
        }

        List<String> segments = Arrays.asList(normalized.split("/"));
        if (segments.contains("..") || normalized.contains("..")) {
            throw new PathSecurityException("Path traversal attempt detected: " + normalized, normalized);
        }
        for (String segment : segments) {
            if (segment.startsWith("~")) {
                throw new PathSecurityException("Home directory access attempt detected: " + normalized, normalized);
            }
        }

        if (normalized.startsWith("/")) {
            for (String prefix : SENSITIVE_PREFIXES) {
                if (normalized.startsWith(prefix)) {
                    throw new PathSecurityException("Suspicious path pattern detected: " + normalized, normalized);
                }
            }
            if (HIDDEN_HOME_FILE.matcher(normalized).find()) {
                throw new PathSecurityException("Suspicious path pattern detected: " + normalized, normalized);
            }
        }
    }

    private static String stripDangerousSegments(String normalized) {
        boolean absolute = normalized.startsWith("/");
        List<String> kept = new ArrayList<>();
        for (String segment : normalized.replace("\0", "").split("/")) {
            if (segment.isEmpty() || "..".equals(segment) || segment.startsWith("~")) continue;
            kept.add(segment);
        }
        return (absolute ? "/" : "") + String.join("/", kept);
    }

    private static String printable(String path) {
        return path.replace("\0", "\\0");
    }

    private boolean analyzeFileContent(byte[] content, String fileName) {
        String extension = FileUtils.getExtension(fileName);

        if (hasExecutableSignature(content)) {
            return false;
        }

        String text = new String(content, 0, Math.min(content.length, TEXT_SCAN_LENGTH), StandardCharsets.UTF_8);

        if (!SCRIPT_EXTENSIONS.contains(extension) && matchesAny(SCRIPT_PATTERNS, text)) {
            return false;
        }

        if (matchesAny(INJECTION_PATTERNS, text)) {
            return false;
        }

        if (options.getAllowedImageTypes().contains(MimeTypes.getMimeType(fileName))) {
            return hasValidImageSignature(content, extension);
        }
        return true;
    }

    private static boolean hasExecutableSignature(byte[] content) {
        for (byte[] signature : EXECUTABLE_SIGNATURES) {
            if (startsWith(content, signature)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasValidImageSignature(byte[] content, String extension) {
        if ("svg".equals(extension)) {
            String head = new String(content, 0, Math.min(content.length, 100), StandardCharsets.UTF_8)
                    .trim()
                    .toLowerCase();
            return head.startsWith("<?xml") || head.startsWith("<svg");
        }

        byte[][] signatures = IMAGE_SIGNATURES.get(extension);
        if (signatures == null) {
            return true; // No known signature (e.g. AVIF), other checks decide
        }
        for (byte[] signature : signatures) {
            if (startsWith(content, signature)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static boolean startsWith(byte[] content, byte[] prefix) {
        if (content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (content[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
