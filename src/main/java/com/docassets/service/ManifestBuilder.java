package com.docassets.service;

import com.docassets.model.AssetDerivative;
import com.docassets.model.AssetManifest;
import com.docassets.model.AssetMetadata;
import com.docassets.model.ManifestEntry;
import com.docassets.model.ProcessedAsset;
import com.docassets.util.ManifestJson;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Folds processed assets into an {@link AssetManifest}. Runs on a single thread over the
 * ordered processing results; the only non-deterministic field is {@code generatedAt}.
 */
public class ManifestBuilder {

    private final Clock clock;
    private final boolean securityScanned;

    public ManifestBuilder() {
        this(Clock.systemUTC(), true);
    }

    /**
     * @param clock           source of the {@code generatedAt} timestamp
     * @param securityScanned value recorded in every entry's metadata
     */
    public ManifestBuilder(Clock clock, boolean securityScanned) {
        this.clock = clock;
        this.securityScanned = securityScanned;
    }

    public AssetManifest generateManifest(List<ProcessedAsset> assets) {
        Map<String, ManifestEntry> entries = new LinkedHashMap<>();
        TreeSet<String> locales = new TreeSet<>();
        TreeSet<String> versions = new TreeSet<>();

        for (ProcessedAsset asset : assets) {
            locales.add(asset.getLocale());
            versions.add(asset.getVersion());
            // A later duplicate replaces the earlier entry
            entries.put(asset.getRelativePath(), toEntry(asset));
        }

        return new AssetManifest(
                AssetManifest.SCHEMA_VERSION,
                ManifestJson.timestamp(clock.instant()),
                entries,
                new ArrayList<>(locales),
                new ArrayList<>(versions));
    }

    private ManifestEntry toEntry(ProcessedAsset asset) {
        Map<String, AssetDerivative> derivatives = new LinkedHashMap<>();
        for (AssetDerivative derivative : asset.getDerivatives()) {
            derivatives.put(derivative.getVariant(), derivative);
        }

        AssetMetadata metadata = new AssetMetadata(
                asset.getLastModified(),
                asset.getReferencedBy(),
                !derivatives.isEmpty(),
                securityScanned);

        return new ManifestEntry(
                asset.getPublicPath(),
                asset.getHashedFilename(),
                asset.getContentHash(),
                asset.getRelativePath(),
                asset.getFileSize(),
                asset.getMimeType(),
                asset.getLocale(),
                asset.getVersion(),
                asset.getDimensions(),
                derivatives,
                metadata);
    }
}
