package com.docassets.util;

import com.docassets.model.AssetReference.AssetType;

import java.util.List;
import java.util.Map;

/**
 * Extension based MIME resolution and the two closed allow-lists that decide
 * whether a file is an image, a downloadable binary, or neither.
 */
public final class MimeTypes {

    public static final String OCTET_STREAM = "application/octet-stream";

    public static final List<String> ALLOWED_IMAGE_TYPES = List.of(
            "image/jpeg", "image/jpg", "image/png", "image/webp", "image/avif",
            "image/gif", "image/svg+xml"
    );

    public static final List<String> ALLOWED_BINARY_TYPES = List.of(
            "application/pdf", "application/zip", "application/json",
            "text/plain", "text/csv", "application/vnd.ms-excel",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"
    );

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("webp", "image/webp"),
            Map.entry("avif", "image/avif"),
            Map.entry("gif", "image/gif"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("pdf", "application/pdf"),
            Map.entry("zip", "application/zip"),
            Map.entry("json", "application/json"),
            Map.entry("txt", "text/plain"),
            Map.entry("csv", "text/csv"),
            Map.entry("xls", "application/vnd.ms-excel"),
            Map.entry("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet")
    );

    private MimeTypes() {
    }

    /**
     * @return the MIME type for the file's extension, or {@link #OCTET_STREAM} when unknown.
     */
    public static String getMimeType(String fileName) {
        return BY_EXTENSION.getOrDefault(FileUtils.getExtension(fileName), OCTET_STREAM);
    }

    public static AssetType determineAssetType(String mimeType) {
        if (ALLOWED_IMAGE_TYPES.contains(mimeType)) {
            return AssetType.IMAGE;
        } else if (ALLOWED_BINARY_TYPES.contains(mimeType)) {
            return AssetType.BINARY;
        }
        return AssetType.UNKNOWN;
    }

    public static AssetType determineAssetTypeFromPath(String fileName) {
        return determineAssetType(getMimeType(fileName));
    }

    /**
     * Public sub-directory for a type: images go to "images", everything else to "files".
     */
    public static String typeDirectory(AssetType type) {
        return type == AssetType.IMAGE ? "images" : "files";
    }
}
