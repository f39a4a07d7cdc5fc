package com.docassets.exception;

import java.util.Map;

/** The published manifest is missing or cannot be parsed. */
public class ManifestLoadException extends AssetPipelineException {
    public ManifestLoadException(String message, String manifestPath, Throwable cause) {
        super(AssetErrorCode.SERIALIZATION_ERROR, message, Map.of("manifest", manifestPath), cause);
    }
}
