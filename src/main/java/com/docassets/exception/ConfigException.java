package com.docassets.exception;

/** Pipeline settings could not be read or are invalid. */
public class ConfigException extends AssetPipelineException {
    public ConfigException(String message) {
        super(AssetErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(AssetErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}
