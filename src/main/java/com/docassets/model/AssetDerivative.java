package com.docassets.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A generated variant of an image asset: a different resolution ("@1x", "@2x",
 * "@640w") or a different format ("webp", "avif").
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"variant", "publicPath", "hashedFilename", "fileSize", "dimensions"})
public class AssetDerivative {
    private final String variant;
    private final String publicPath;
    private final String hashedFilename;
    private final long fileSize;
    private final ImageDimensions dimensions;

    // Encoded bytes waiting to be published. Never part of the manifest.
    @JsonIgnore
    private final byte[] content;

    @JsonCreator
    public AssetDerivative(@JsonProperty("variant") String variant,
                           @JsonProperty("publicPath") String publicPath,
                           @JsonProperty("hashedFilename") String hashedFilename,
                           @JsonProperty("fileSize") long fileSize,
                           @JsonProperty("dimensions") ImageDimensions dimensions) {
        this(variant, publicPath, hashedFilename, fileSize, dimensions, null);
    }

    public AssetDerivative(String variant, String publicPath, String hashedFilename, long fileSize,
                           ImageDimensions dimensions, byte[] content) {
        this.variant = variant;
        this.publicPath = publicPath;
        this.hashedFilename = hashedFilename;
        this.fileSize = fileSize;
        this.dimensions = dimensions;
        this.content = content;
    }

    public String getVariant() { return variant; }
    public String getPublicPath() { return publicPath; }
    public String getHashedFilename() { return hashedFilename; }
    public long getFileSize() { return fileSize; }
    public ImageDimensions getDimensions() { return dimensions; }

    @JsonIgnore
    public byte[] getContent() {
        return content;
    }

    @JsonIgnore
    public boolean hasContent() {
        return content != null;
    }
}
