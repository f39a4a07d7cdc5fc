package com.docassets.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the asset pipeline, carrying an {@link AssetErrorCode}
 * and optional key/value context (typically the offending path).
 */
public class AssetPipelineException extends RuntimeException {
    private final AssetErrorCode code;
    private final Map<String, Object> context;

    public AssetPipelineException(AssetErrorCode code, String message) {
        this(code, message, Collections.emptyMap(), null);
    }

    public AssetPipelineException(AssetErrorCode code, String message, Throwable cause) {
        this(code, message, Collections.emptyMap(), cause);
    }

    public AssetPipelineException(AssetErrorCode code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.context = copy(context);
    }

    public AssetErrorCode getCode() {
        return code;
    }

    /** Additional details that help diagnosing the error. */
    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) return Collections.emptyMap();
        Map<String, Object> m = new LinkedHashMap<>();
        input.forEach(m::put);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{code=" + code
                + ", message=" + getMessage()
                + (context.isEmpty() ? "" : ", context=" + context)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
