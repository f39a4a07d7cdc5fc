package com.docassets.repository;

import com.docassets.exception.ManifestLoadException;
import com.docassets.model.AssetManifest;
import com.docassets.util.ManifestJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ManifestCacheTest {

    @TempDir
    Path tempDir;

    private Path manifestPath;
    private ManifestCache cache;

    @BeforeEach
    void setUp() {
        manifestPath = tempDir.resolve("public/assets").resolve(AssetManifest.FILE_NAME);
        cache = new ManifestCache(manifestPath);
    }

    @Test
    void testGet_ShouldLoadOnceAndReuse() throws IOException {
        writeManifest("2024-01-01T00:00:00.000Z", List.of("en"));

        AssetManifest first = cache.get();
        AssetManifest second = cache.get();

        assertTrue(cache.isLoaded());
        assertSame(first, second);
        assertEquals(List.of("en"), first.getLocales());
    }

    @Test
    void testGet_ShouldNotSeeChangesUntilInvalidated() throws IOException {
        writeManifest("2024-01-01T00:00:00.000Z", List.of("en"));
        AssetManifest before = cache.get();

        writeManifest("2024-02-01T00:00:00.000Z", List.of("en", "es"));
        assertSame(before, cache.get());

        cache.invalidate();
        assertFalse(cache.isLoaded());
        AssetManifest after = cache.get();
        assertEquals("2024-02-01T00:00:00.000Z", after.getGeneratedAt());
        assertEquals(List.of("en", "es"), after.getLocales());
    }

    /**
     * A failed load is not cached: the next call tries again.
     */
    @Test
    void testGet_MissingFile_ShouldThrowAndRetryLater() throws IOException {
        ManifestLoadException ex = assertThrows(ManifestLoadException.class, () -> cache.get());
        assertTrue(ex.getMessage().contains("not found"));
        assertFalse(cache.isLoaded());

        writeManifest("2024-01-01T00:00:00.000Z", List.of("en"));

        assertNotNull(cache.get());
    }

    @Test
    void testGet_MalformedFile_ShouldThrow() throws IOException {
        Files.createDirectories(manifestPath.getParent());
        Files.writeString(manifestPath, "{ not json");

        ManifestLoadException ex = assertThrows(ManifestLoadException.class, () -> cache.get());

        assertNotNull(ex.getCause());
        assertEquals(manifestPath, cache.getManifestPath());
    }

    private void writeManifest(String generatedAt, List<String> locales) throws IOException {
        Files.createDirectories(manifestPath.getParent());
        AssetManifest manifest = new AssetManifest(AssetManifest.SCHEMA_VERSION, generatedAt, Map.of(), locales, List.of("v1"));
        Files.write(manifestPath, ManifestJson.prettyWriter().writeValueAsBytes(manifest));
    }
}
