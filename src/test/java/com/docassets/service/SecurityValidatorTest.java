package com.docassets.service;

import com.docassets.TestImages;
import com.docassets.exception.PathSecurityException;
import com.docassets.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SecurityValidator}.
 * Covers type allow-listing, path sanitization in both modes, the size limit,
 * content scanning, and isolation of results in batch validation.
 */
class SecurityValidatorTest {

    private static final long MAX_SIZE = 100;

    @TempDir
    Path tempDir;

    private SecurityValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SecurityValidator(SecurityOptions.defaults().maxFileSize(MAX_SIZE).workerThreads(4));
    }

    @Test
    void testValidateFileType_AllowedAndRejected() {
        assertTrue(validator.validateFileType(Path.of("logo.png")));
        assertTrue(validator.validateFileType(Path.of("guide.PDF")));
        assertFalse(validator.validateFileType(Path.of("setup.exe")));
        assertFalse(validator.validateFileType(Path.of("noextension")));
    }

    /**
     * Every traversal or system-path attempt is rejected in strict mode.
     */
    @Test
    void testSanitizePath_Strict_ShouldRejectDangerousPaths() {
        List<String> dangerous = List.of(
                "../../../etc/passwd",
                "..\\..\\windows\\system32",
                "~/secret.txt",
                "/etc/passwd",
                "/proc/version",
                "/var/log/syslog",
                "/root/.bashrc",
                "/home/alice/.ssh/id_rsa",
                "images/logo.png\0.txt"
        );

        for (String path : dangerous) {
            assertThrows(PathSecurityException.class, () -> validator.sanitizePath(path, true),
                    "Expected rejection for " + path.replace("\0", "\\0"));
        }
    }

    @Test
    void testSanitizePath_Strict_ShouldNormalizeSafePaths() {
        assertEquals("en/v1/assets/images/logo.png", validator.sanitizePath("./en/v1/assets//images/./logo.png", true));
        assertEquals("en/v1/assets/logo.png", validator.sanitizePath("en\\v1\\assets\\logo.png", true));
        assertEquals("content/logo.png", validator.sanitizePath("C:\\content\\logo.png", true));
        assertEquals("srv/docs/logo.png", validator.sanitizePath("/srv/docs/logo.png", true));
    }

    /**
     * Lenient mode repairs rather than rejects.
     */
    @Test
    void testSanitizePath_Lenient_ShouldStripDangerousSegments() {
        assertEquals("etc/passwd", validator.sanitizePath("../../etc/passwd", false));
        assertEquals("notes.txt", validator.sanitizePath("~/notes.txt", false));
        assertEquals("images/logo.png", validator.sanitizePath("images/lo\0go.png", false));
    }

    @Test
    void testCheckFileSize_ShouldRespectLimitExactly() throws IOException {
        Path atLimit = writeBytes("at-limit.txt", repeat('a', (int) MAX_SIZE));
        Path overLimit = writeBytes("over-limit.txt", repeat('a', (int) MAX_SIZE + 1));

        assertTrue(validator.checkFileSize(atLimit));
        assertFalse(validator.checkFileSize(overLimit));
        assertFalse(validator.checkFileSize(tempDir.resolve("missing.txt")));
    }

    @Test
    void testValidateAsset_OverSizeLimit_ShouldReportSizeError() throws IOException {
        Path file = writeBytes("big.txt", repeat('a', (int) MAX_SIZE + 1));

        ValidationResult result = validator.validateAsset(file, "en/v1/assets/files/big.txt");

        assertFalse(result.isValid());
        assertTrue(result.getErrors().stream().anyMatch(e -> e.contains("exceeds maximum allowed size")),
                "Errors: " + result.getErrors());
    }

    @Test
    void testValidateAsset_WithinSizeLimit_ShouldPass() throws IOException {
        Path file = writeBytes("small.txt", repeat('a', (int) MAX_SIZE));

        ValidationResult result = validator.validateAsset(file, "en/v1/assets/files/small.txt");

        assertTrue(result.isValid(), "Errors: " + result.getErrors());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    void testValidateAsset_MissingFile_ShouldFail() {
        ValidationResult result = validator.validateAsset(tempDir.resolve("ghost.png"), "en/v1/assets/ghost.png");

        assertFalse(result.isValid());
        assertEquals(List.of("File does not exist: en/v1/assets/ghost.png"), result.getErrors());
    }

    @Test
    void testValidateAsset_DisallowedType_ShouldFail() throws IOException {
        Path file = writeBytes("tool.exe", "harmless".getBytes(StandardCharsets.UTF_8));

        ValidationResult result = validator.validateAsset(file, "en/v1/assets/files/tool.exe");

        assertFalse(result.isValid());
        assertTrue(result.getErrors().contains("File type not allowed: application/octet-stream"));
    }

    @Test
    void testValidateAsset_TraversalInLogicalPath_ShouldFail() throws IOException {
        Path file = writeBytes("ok.txt", "fine".getBytes(StandardCharsets.UTF_8));

        ValidationResult result = validator.validateAsset(file, "../outside/ok.txt");

        assertFalse(result.isValid());
        assertTrue(result.getErrors().get(0).startsWith("Path validation failed"));
    }

    @Test
    void testValidateAsset_SanitizedPath_ShouldWarn() throws IOException {
        Path file = writeBytes("ok.txt", "fine".getBytes(StandardCharsets.UTF_8));

        ValidationResult result = validator.validateAsset(file, "./en/v1/assets/ok.txt");

        assertTrue(result.isValid());
        assertEquals("en/v1/assets/ok.txt", result.getSanitizedPath());
        assertEquals(1, result.getWarnings().size());
    }

    /**
     * A Windows executable renamed to .png is caught by its magic bytes.
     */
    @Test
    void testScan_ExecutableDisguisedAsPng_ShouldBeRejected() throws IOException {
        byte[] pe = new byte[64];
        pe[0] = 0x4D;
        pe[1] = 0x5A;
        Path file = writeBytes("fake.png", pe);

        assertFalse(validator.scanForMaliciousContent(file));
        ValidationResult result = validator.validateAsset(file, "en/v1/assets/images/fake.png");
        assertFalse(result.isValid());
        assertTrue(result.getErrors().contains("File content appears to be malicious or suspicious"));
    }

    @Test
    void testScan_ElfInsidePdf_ShouldBeRejected() throws IOException {
        Path file = writeBytes("manual.pdf", new byte[]{0x7F, 0x45, 0x4C, 0x46, 0, 0, 0, 0});

        assertFalse(validator.scanForMaliciousContent(file));
    }

    @Test
    void testScan_RealPng_ShouldPass() throws IOException {
        Path file = TestImages.writePng(tempDir.resolve("real.png"), 8, 8, 1);

        assertTrue(validator.scanForMaliciousContent(file));
    }

    @Test
    void testScan_PngWithWrongSignature_ShouldBeRejected() throws IOException {
        Path file = writeBytes("text.png", "just some text".getBytes(StandardCharsets.UTF_8));

        assertFalse(validator.scanForMaliciousContent(file));
    }

    @Test
    void testScan_SvgSignatureAndEventHandlers() throws IOException {
        Path clean = writeBytes("clean.svg",
                "  <svg xmlns=\"http://www.w3.org/2000/svg\" width=\"10\" height=\"10\"></svg>".getBytes(StandardCharsets.UTF_8));
        Path handler = writeBytes("handler.svg",
                "<svg xmlns=\"http://www.w3.org/2000/svg\" onload=\"alert(1)\"></svg>".getBytes(StandardCharsets.UTF_8));
        Path notSvg = writeBytes("plain.svg", "hello".getBytes(StandardCharsets.UTF_8));

        assertTrue(validator.scanForMaliciousContent(clean));
        assertFalse(validator.scanForMaliciousContent(handler));
        assertFalse(validator.scanForMaliciousContent(notSvg));
    }

    @Test
    void testScan_ScriptMarkers_ShouldDependOnExtension() throws IOException {
        byte[] script = "<script>alert(1)</script>".getBytes(StandardCharsets.UTF_8);
        Path asText = writeBytes("notes.txt", script);
        Path asJs = writeBytes("widget.js", script);

        assertFalse(validator.scanForMaliciousContent(asText));
        assertTrue(validator.scanForMaliciousContent(asJs));
    }

    @Test
    void testScan_InjectionMarkers_ShouldBeRejected() throws IOException {
        assertFalse(validator.scanForMaliciousContent(writeBytes("a.txt", "Hello {{user.name}}".getBytes(StandardCharsets.UTF_8))));
        assertFalse(validator.scanForMaliciousContent(writeBytes("b.txt", "<?php echo 1; ?>".getBytes(StandardCharsets.UTF_8))));
        assertFalse(validator.scanForMaliciousContent(writeBytes("c.csv", "name,${jndi:ldap}".getBytes(StandardCharsets.UTF_8))));
        assertTrue(validator.scanForMaliciousContent(writeBytes("d.csv", "name,condition=ok".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void testScan_Disabled_ShouldAlwaysPass() throws IOException {
        SecurityValidator relaxed = new SecurityValidator(SecurityOptions.defaults().enableContentScanning(false));
        Path file = writeBytes("fake.png", new byte[]{0x4D, 0x5A, 0, 0});

        assertTrue(relaxed.scanForMaliciousContent(file));
    }

    /**
     * One bad file never affects the verdict of the others, and results keep input order.
     */
    @Test
    void testValidateAll_ShouldIsolateFailures() throws IOException {
        Map<String, Path> files = new LinkedHashMap<>();
        files.put("en/v1/assets/images/good.png", TestImages.writePng(tempDir.resolve("good.png"), 4, 4, 2));
        files.put("en/v1/assets/images/missing.png", tempDir.resolve("missing.png"));
        files.put("en/v1/assets/images/evil.png", writeBytes("evil.png", new byte[]{0x4D, 0x5A, 0, 0}));
        files.put("en/v1/assets/files/notes.txt", writeBytes("notes.txt", "plain notes".getBytes(StandardCharsets.UTF_8)));

        SecurityValidator batchValidator = new SecurityValidator(SecurityOptions.defaults().workerThreads(4));
        Map<String, ValidationResult> results = batchValidator.validateAll(files);

        assertEquals(new ArrayList<>(files.keySet()), new ArrayList<>(results.keySet()));
        assertTrue(results.get("en/v1/assets/images/good.png").isValid());
        assertFalse(results.get("en/v1/assets/images/missing.png").isValid());
        assertFalse(results.get("en/v1/assets/images/evil.png").isValid());
        assertTrue(results.get("en/v1/assets/files/notes.txt").isValid());
    }

    @Test
    void testValidateAssets_ShouldReturnOneResultPerPathInOrder() throws IOException {
        Path first = writeBytes("first.txt", "one".getBytes(StandardCharsets.UTF_8));
        Path missing = tempDir.resolve("nope.txt");
        Path last = writeBytes("last.txt", "two".getBytes(StandardCharsets.UTF_8));

        Map<Path, ValidationResult> results = validator.validateAssets(List.of(first, missing, last));

        assertEquals(List.of(first, missing, last), new ArrayList<>(results.keySet()));
        assertFalse(results.get(missing).isValid());
    }

    @Test
    void testValidateAssets_EmptyInput_ShouldReturnEmptyMap() {
        assertTrue(validator.validateAssets(List.of()).isEmpty());
    }

    private Path writeBytes(String name, byte[] content) throws IOException {
        return Files.write(tempDir.resolve(name), content);
    }

    private static byte[] repeat(char c, int count) {
        byte[] bytes = new byte[count];
        java.util.Arrays.fill(bytes, (byte) c);
        return bytes;
    }
}
