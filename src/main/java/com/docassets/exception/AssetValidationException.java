package com.docassets.exception;

import java.util.List;
import java.util.Map;

/** One or more discovered assets failed security validation; nothing was published. */
public class AssetValidationException extends AssetPipelineException {
    private final List<String> failedPaths;

    public AssetValidationException(String message, List<String> failedPaths) {
        super(AssetErrorCode.INVALID_ARGUMENT, message, Map.of("failed", failedPaths.size()), null);
        this.failedPaths = List.copyOf(failedPaths);
    }

    public List<String> getFailedPaths() {
        return failedPaths;
    }
}
