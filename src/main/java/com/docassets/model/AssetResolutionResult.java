package com.docassets.model;

/**
 * Where a logical asset reference resolved to, and whether a fallback tier was needed.
 */
public class AssetResolutionResult {
    private final String publicPath;
    private final ManifestEntry entry;
    private final boolean fallbackUsed;
    private final FallbackType fallbackType;

    public enum FallbackType {
        VERSION, LOCALE, DIRECT;

        public String label() {
            return name().toLowerCase();
        }
    }

    public AssetResolutionResult(String publicPath, ManifestEntry entry, boolean fallbackUsed, FallbackType fallbackType) {
        this.publicPath = publicPath;
        this.entry = entry;
        this.fallbackUsed = fallbackUsed;
        this.fallbackType = fallbackType;
    }

    public static AssetResolutionResult exact(ManifestEntry entry) {
        return new AssetResolutionResult(entry.getPublicPath(), entry, false, null);
    }

    public static AssetResolutionResult fallback(ManifestEntry entry, FallbackType type) {
        return new AssetResolutionResult(entry.getPublicPath(), entry, true, type);
    }

    /**
     * An unhashed guess used when no manifest entry exists. The path may not exist at serve time.
     */
    public static AssetResolutionResult direct(String guessedPath) {
        return new AssetResolutionResult(guessedPath, null, true, FallbackType.DIRECT);
    }

    public String getPublicPath() { return publicPath; }

    /**
     * @return the matched manifest entry, or null for a direct guess.
     */
    public ManifestEntry getEntry() { return entry; }

    public boolean isFallbackUsed() { return fallbackUsed; }

    /**
     * @return the tier that produced this result, or null for an exact match.
     */
    public FallbackType getFallbackType() { return fallbackType; }

    @Override
    public String toString() {
        return publicPath + (fallbackUsed ? " (fallback: " + fallbackType.label() + ")" : "");
    }
}
