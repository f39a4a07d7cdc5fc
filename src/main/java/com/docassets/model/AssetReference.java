package com.docassets.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Represents an asset file found in the content tree during discovery.
 * Lives only for the duration of a build run and is never persisted.
 */
public class AssetReference {
    private final Path sourcePath; // Absolute or working-directory relative location on disk
    private final String relativePath; // Relative to the content root, always '/' separated
    private final String locale;
    private final String version;
    private final AssetType type;
    private List<String> referencedBy = new ArrayList<>();

    public enum AssetType {
        IMAGE, BINARY, UNKNOWN;

        /**
         * @return the lowercase label used in logs and reports (e.g. "image").
         */
        public String label() {
            return name().toLowerCase();
        }
    }

    public AssetReference(Path sourcePath, String relativePath, String locale, String version, AssetType type) {
        this.sourcePath = sourcePath;
        this.relativePath = relativePath;
        this.locale = locale;
        this.version = version;
        this.type = type;
    }

    protected AssetReference(AssetReference other) {
        this(other.sourcePath, other.relativePath, other.locale, other.version, other.type);
        this.referencedBy = new ArrayList<>(other.referencedBy);
    }

    public Path getSourcePath() { return sourcePath; }
    public String getRelativePath() { return relativePath; }
    public String getLocale() { return locale; }
    public String getVersion() { return version; }
    public AssetType getType() { return type; }

    public List<String> getReferencedBy() {
        return referencedBy;
    }

    public void setReferencedBy(List<String> referencedBy) {
        this.referencedBy = referencedBy;
    }

    public void addReference(String documentPath) {
        this.referencedBy.add(documentPath);
    }

    @Override
    public String toString() {
        return relativePath + " (" + type.label() + ")";
    }
}
