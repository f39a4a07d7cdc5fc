package com.docassets.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One published asset as recorded in the manifest, keyed there by its original
 * relative path. Immutable once built.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"publicPath", "hashedFilename", "contentHash", "originalPath", "fileSize", "mimeType",
        "locale", "version", "dimensions", "derivatives", "metadata"})
public class ManifestEntry {
    private final String publicPath;
    private final String hashedFilename;
    private final String contentHash;
    private final String originalPath;
    private final long fileSize;
    private final String mimeType;
    private final String locale;
    private final String version;
    private final ImageDimensions dimensions;
    private final Map<String, AssetDerivative> derivatives;
    private final AssetMetadata metadata;

    @JsonCreator
    public ManifestEntry(@JsonProperty("publicPath") String publicPath,
                         @JsonProperty("hashedFilename") String hashedFilename,
                         @JsonProperty("contentHash") String contentHash,
                         @JsonProperty("originalPath") String originalPath,
                         @JsonProperty("fileSize") long fileSize,
                         @JsonProperty("mimeType") String mimeType,
                         @JsonProperty("locale") String locale,
                         @JsonProperty("version") String version,
                         @JsonProperty("dimensions") ImageDimensions dimensions,
                         @JsonProperty("derivatives") Map<String, AssetDerivative> derivatives,
                         @JsonProperty("metadata") AssetMetadata metadata) {
        this.publicPath = publicPath;
        this.hashedFilename = hashedFilename;
        this.contentHash = contentHash;
        this.originalPath = originalPath;
        this.fileSize = fileSize;
        this.mimeType = mimeType;
        this.locale = locale;
        this.version = version;
        this.dimensions = dimensions;
        this.derivatives = derivatives == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(derivatives));
        this.metadata = metadata;
    }

    public String getPublicPath() { return publicPath; }
    public String getHashedFilename() { return hashedFilename; }
    public String getContentHash() { return contentHash; }
    public String getOriginalPath() { return originalPath; }
    public long getFileSize() { return fileSize; }
    public String getMimeType() { return mimeType; }
    public String getLocale() { return locale; }
    public String getVersion() { return version; }
    public ImageDimensions getDimensions() { return dimensions; }
    public Map<String, AssetDerivative> getDerivatives() { return derivatives; }
    public AssetMetadata getMetadata() { return metadata; }

    /**
     * @return true when this entry was published for exactly the given locale and version.
     */
    public boolean belongsTo(String locale, String version) {
        return this.locale != null && this.locale.equals(locale)
                && this.version != null && this.version.equals(version);
    }
}
