package com.docassets.service;

import com.docassets.model.AssetReference.AssetType;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one pipeline run, printed by the CLI.
 */
public class PipelineReport {
    private final int discovered;
    private final int processed;
    private final int derivatives;
    private final int filesWritten;
    private final List<String> locales;
    private final List<String> versions;
    private final Map<AssetType, Integer> assetsByType;
    private final Path manifestPath;
    private final boolean dryRun;

    public PipelineReport(int discovered, int processed, int derivatives, int filesWritten,
                          List<String> locales, List<String> versions, Map<AssetType, Integer> assetsByType,
                          Path manifestPath, boolean dryRun) {
        this.discovered = discovered;
        this.processed = processed;
        this.derivatives = derivatives;
        this.filesWritten = filesWritten;
        this.locales = List.copyOf(locales);
        this.versions = List.copyOf(versions);
        this.assetsByType = assetsByType.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(assetsByType));
        this.manifestPath = manifestPath;
        this.dryRun = dryRun;
    }

    public int getDiscovered() { return discovered; }
    public int getProcessed() { return processed; }
    public int getDerivatives() { return derivatives; }

    /**
     * @return files copied or written, 0 for a dry run
     */
    public int getFilesWritten() { return filesWritten; }

    public List<String> getLocales() { return locales; }
    public List<String> getVersions() { return versions; }
    public Map<AssetType, Integer> getAssetsByType() { return assetsByType; }

    /**
     * @return where the manifest was (or, for a dry run, would have been) written
     */
    public Path getManifestPath() { return manifestPath; }

    public boolean isDryRun() { return dryRun; }
}
