package com.docassets.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The single document mapping original asset paths to their published, hashed
 * locations. Written once per build and replaced wholesale by the next one, so an
 * instance is a read-only snapshot.
 */
@JsonPropertyOrder({"version", "generatedAt", "assets", "locales", "versions"})
public class AssetManifest {
    public static final String SCHEMA_VERSION = "1.0.0";
    public static final String FILE_NAME = "assets-manifest.json";

    private final String version;
    private final String generatedAt;
    private final Map<String, ManifestEntry> assets;
    private final List<String> locales;
    private final List<String> versions;

    @JsonCreator
    public AssetManifest(@JsonProperty("version") String version,
                         @JsonProperty("generatedAt") String generatedAt,
                         @JsonProperty("assets") Map<String, ManifestEntry> assets,
                         @JsonProperty("locales") List<String> locales,
                         @JsonProperty("versions") List<String> versions) {
        this.version = version;
        this.generatedAt = generatedAt;
        this.assets = assets == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(assets));
        this.locales = locales == null ? List.of() : List.copyOf(locales);
        this.versions = versions == null ? List.of() : List.copyOf(versions);
    }

    public String getVersion() { return version; }
    public String getGeneratedAt() { return generatedAt; }
    public Map<String, ManifestEntry> getAssets() { return assets; }
    public List<String> getLocales() { return locales; }
    public List<String> getVersions() { return versions; }

    public ManifestEntry getEntry(String relativePath) {
        return assets.get(relativePath);
    }
}
