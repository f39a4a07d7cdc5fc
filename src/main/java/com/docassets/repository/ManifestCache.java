package com.docassets.repository;

import com.docassets.exception.ManifestLoadException;
import com.docassets.model.AssetManifest;
import com.docassets.util.BuildLogger;
import com.docassets.util.ManifestJson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lazily loaded, read-only view of the published manifest.
 * The first {@link #get()} parses the file; later calls return the same snapshot until
 * {@link #invalidate()} is called. A failed load is not remembered, so the next call retries.
 */
public class ManifestCache {

    private final Path manifestPath;
    private volatile AssetManifest cached;

    public ManifestCache(Path manifestPath) {
        this.manifestPath = manifestPath;
    }

    public Path getManifestPath() {
        return manifestPath;
    }

    /**
     * @throws ManifestLoadException if the manifest is missing or malformed
     */
    public AssetManifest get() {
        AssetManifest manifest = cached;
        if (manifest != null) {
            return manifest;
        }
        synchronized (this) {
            if (cached == null) {
                cached = load();
            }
            return cached;
        }
    }

    public boolean isLoaded() {
        return cached != null;
    }

    public synchronized void invalidate() {
        cached = null;
    }

    private AssetManifest load() {
        if (!Files.isRegularFile(manifestPath)) {
            throw new ManifestLoadException("Asset manifest not found: " + manifestPath, manifestPath.toString(), null);
        }
        try {
            AssetManifest manifest = ManifestJson.mapper().readValue(manifestPath.toFile(), AssetManifest.class);
            if (manifest == null) {
                throw new ManifestLoadException("Asset manifest is empty: " + manifestPath, manifestPath.toString(), null);
            }
            BuildLogger.logDebug("ManifestCache", "Loaded " + manifest.getAssets().size() + " entries from " + manifestPath);
            return manifest;
        } catch (IOException e) {
            throw new ManifestLoadException("Failed to parse asset manifest " + manifestPath + ": " + e.getMessage(),
                    manifestPath.toString(), e);
        }
    }
}
