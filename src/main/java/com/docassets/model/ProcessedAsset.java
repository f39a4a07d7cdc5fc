package com.docassets.model;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@link AssetReference} after hashing: knows its content hash, its hashed
 * file name and where it is published. Every field is a pure function of the
 * file bytes, its location in the content tree and its modification time.
 */
public class ProcessedAsset extends AssetReference {
    private final String publicPath;
    private final String hashedFilename;
    private final String contentHash;
    private final long fileSize;
    private final String mimeType;
    private final String lastModified;
    private ImageDimensions dimensions;
    private List<AssetDerivative> derivatives = new ArrayList<>();

    public ProcessedAsset(AssetReference reference, String publicPath, String hashedFilename, String contentHash,
                          long fileSize, String mimeType, String lastModified) {
        super(reference);
        this.publicPath = publicPath;
        this.hashedFilename = hashedFilename;
        this.contentHash = contentHash;
        this.fileSize = fileSize;
        this.mimeType = mimeType;
        this.lastModified = lastModified;
    }

    public String getPublicPath() { return publicPath; }
    public String getHashedFilename() { return hashedFilename; }
    public String getContentHash() { return contentHash; }
    public long getFileSize() { return fileSize; }
    public String getMimeType() { return mimeType; }
    public String getLastModified() { return lastModified; }

    /**
     * @return pixel dimensions, or null when unknown or not an image.
     */
    public ImageDimensions getDimensions() {
        return dimensions;
    }

    public void setDimensions(ImageDimensions dimensions) {
        this.dimensions = dimensions;
    }

    public List<AssetDerivative> getDerivatives() {
        return derivatives;
    }

    public void setDerivatives(List<AssetDerivative> derivatives) {
        this.derivatives = derivatives;
    }

    public void addDerivatives(List<AssetDerivative> additional) {
        this.derivatives.addAll(additional);
    }
}
