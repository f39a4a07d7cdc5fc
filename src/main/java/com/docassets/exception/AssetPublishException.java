package com.docassets.exception;

import java.util.Map;

/**
 * Copying an asset or writing the manifest failed. When several assets fail in one
 * publish run, the individual failures are attached as suppressed exceptions.
 */
public class AssetPublishException extends AssetPipelineException {
    public AssetPublishException(String message, String target, Throwable cause) {
        super(AssetErrorCode.IO_ERROR, message, Map.of("target", String.valueOf(target)), cause);
    }

    public AssetPublishException(String message) {
        super(AssetErrorCode.IO_ERROR, message);
    }
}
