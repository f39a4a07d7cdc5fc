package com.docassets.exception;

import java.util.Map;

/** A path was rejected as a traversal or injection attempt. */
public class PathSecurityException extends AssetPipelineException {
    public PathSecurityException(String message, String path) {
        super(AssetErrorCode.PERMISSION_DENIED, message, Map.of("path", path), null);
    }
}
