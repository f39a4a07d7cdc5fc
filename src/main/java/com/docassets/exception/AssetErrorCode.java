package com.docassets.exception;

/**
 * Stable error codes for pipeline failures, suitable for logs and exit reporting.
 */
public enum AssetErrorCode {
    UNKNOWN,
    INVALID_ARGUMENT,
    PERMISSION_DENIED,
    NOT_FOUND,
    CANCELLED,

    CONFIGURATION_ERROR,
    IO_ERROR,
    SERIALIZATION_ERROR,
}
