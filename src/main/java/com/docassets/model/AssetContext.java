package com.docassets.model;

import java.util.Objects;

/**
 * The render-time lookup key: which locale and documentation version a page belongs to.
 */
public final class AssetContext {
    private final String locale;
    private final String version;

    public AssetContext(String locale, String version) {
        this.locale = Objects.requireNonNull(locale, "locale");
        this.version = Objects.requireNonNull(version, "version");
    }

    public String getLocale() { return locale; }
    public String getVersion() { return version; }

    public AssetContext withLocale(String otherLocale) {
        return new AssetContext(otherLocale, version);
    }

    public AssetContext withVersion(String otherVersion) {
        return new AssetContext(locale, otherVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssetContext)) return false;
        AssetContext that = (AssetContext) o;
        return locale.equals(that.locale) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(locale, version);
    }

    @Override
    public String toString() {
        return locale + "/" + version;
    }
}
