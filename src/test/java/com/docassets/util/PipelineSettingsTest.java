package com.docassets.util;

import com.docassets.exception.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link PipelineSettings}.
 * Covers defaults, loading from JSON, overrides and validation of numeric values.
 */
class PipelineSettingsTest {

    @TempDir
    Path tempDir;

    /**
     * A missing settings file is not an error: every key falls back to its default.
     */
    @Test
    void testLoad_MissingFile_ShouldUseDefaults() {
        PipelineSettings settings = PipelineSettings.load(tempDir.resolve("absent.json"));

        assertEquals("content", settings.getContentDir());
        assertEquals("public/assets", settings.getPublicDir());
        assertEquals(".", settings.getOutputRoot());
        assertEquals("en", settings.getDefaultLocale());
        assertEquals(List.of("en", "es", "pt"), settings.getLocales());
        assertEquals("v1", settings.getDefaultVersion());
        assertEquals(10L * 1024 * 1024, settings.getMaxFileSize());
        assertTrue(settings.isSecurityEnabled());
        assertTrue(settings.isResponsiveVariantsEnabled());
        assertTrue(settings.isModernFormatsEnabled());
        assertEquals(85, settings.getImageQuality());
        assertEquals(80, settings.getAvifQuality());
        assertTrue(settings.getResponsiveSizes().isEmpty());
        assertTrue(settings.getWorkerThreads() >= 1);
    }

    /**
     * Values from the file override defaults; invalid responsive sizes are dropped.
     */
    @Test
    void testLoad_FixtureFile_ShouldReadValues() throws Exception {
        Path fixture = Paths.get(getClass().getResource("/settings/asset-pipeline.json").toURI());

        PipelineSettings settings = PipelineSettings.load(fixture);

        assertEquals("docs/content", settings.getContentDir());
        assertEquals("static/assets", settings.getPublicDir());
        assertEquals("es", settings.getDefaultLocale());
        assertEquals(List.of("es", "en"), settings.getLocales());
        assertFalse(settings.isSecurityEnabled());
        assertEquals(List.of(640, 320), settings.getResponsiveSizes());
        assertEquals(70, settings.getImageQuality());
        assertEquals(2, settings.getWorkerThreads());
        // Not in the file
        assertEquals(80, settings.getAvifQuality());
    }

    @Test
    void testLoad_MalformedJson_ShouldThrowConfigException() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ \"content_dir\": ");

        assertThrows(ConfigException.class, () -> PipelineSettings.load(file));
    }

    @Test
    void testLoad_NonObjectJson_ShouldThrowConfigException() throws Exception {
        Path file = tempDir.resolve("array.json");
        Files.writeString(file, "[1, 2, 3]");

        assertThrows(ConfigException.class, () -> PipelineSettings.load(file));
    }

    @Test
    void testGetImageQuality_OutOfRange_ShouldThrowConfigException() throws Exception {
        Path file = tempDir.resolve("quality.json");
        Files.writeString(file, "{\"image_quality\": 150}");

        PipelineSettings settings = PipelineSettings.load(file);

        assertThrows(ConfigException.class, settings::getImageQuality);
    }

    @Test
    void testGetMaxFileSize_NotPositive_ShouldThrowConfigException() {
        PipelineSettings settings = PipelineSettings.defaults();
        settings.setMaxFileSize(0);

        assertThrows(ConfigException.class, settings::getMaxFileSize);
    }

    /**
     * Overrides set through setters survive a save/load cycle.
     */
    @Test
    void testSave_ShouldPersistOverrides() {
        PipelineSettings settings = PipelineSettings.defaults();
        settings.setContentDir("site/content");
        settings.setSecurityEnabled(false);
        settings.setLocales(List.of("pt"));
        Path file = tempDir.resolve("nested").resolve("asset-pipeline.json");

        settings.save(file);
        PipelineSettings reloaded = PipelineSettings.load(file);

        assertTrue(Files.exists(file));
        assertEquals("site/content", reloaded.getContentDir());
        assertFalse(reloaded.isSecurityEnabled());
        assertEquals(List.of("pt"), reloaded.getLocales());
    }
}
