package com.docassets.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"lastModified", "referencedBy", "optimized", "securityScanned"})
public class AssetMetadata {
    private final String lastModified;
    private final List<String> referencedBy;
    private final boolean optimized;
    private final boolean securityScanned;

    @JsonCreator
    public AssetMetadata(@JsonProperty("lastModified") String lastModified,
                         @JsonProperty("referencedBy") List<String> referencedBy,
                         @JsonProperty("optimized") boolean optimized,
                         @JsonProperty("securityScanned") boolean securityScanned) {
        this.lastModified = lastModified;
        this.referencedBy = referencedBy == null ? List.of() : List.copyOf(referencedBy);
        this.optimized = optimized;
        this.securityScanned = securityScanned;
    }

    public String getLastModified() { return lastModified; }
    public List<String> getReferencedBy() { return referencedBy; }
    public boolean isOptimized() { return optimized; }
    public boolean isSecurityScanned() { return securityScanned; }
}
