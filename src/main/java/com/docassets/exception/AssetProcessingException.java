package com.docassets.exception;

import java.nio.file.Path;
import java.util.Map;

/** Reading or hashing an asset failed. Aborts only that asset. */
public class AssetProcessingException extends AssetPipelineException {
    private final Path path;

    public AssetProcessingException(Path path, String message, Throwable cause) {
        super(AssetErrorCode.IO_ERROR, message, Map.of("path", String.valueOf(path)), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
