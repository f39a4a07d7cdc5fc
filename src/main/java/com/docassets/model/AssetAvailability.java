package com.docassets.model;

/**
 * One row of an asset's existence matrix across every known locale/version context.
 */
public class AssetAvailability {
    private final AssetContext context;
    private final boolean available;

    public AssetAvailability(AssetContext context, boolean available) {
        this.context = context;
        this.available = available;
    }

    public AssetContext getContext() { return context; }
    public boolean isAvailable() { return available; }

    @Override
    public String toString() {
        return context + "=" + (available ? "present" : "missing");
    }
}
