package com.docassets.cli;

import com.docassets.exception.AssetPipelineException;
import picocli.CommandLine;

/**
 * Prints one line per failure, with the error code for pipeline errors.
 * Stack traces only with {@code -Ddocassets.debug=true}.
 */
public final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
            Exception ex,
            CommandLine commandLine,
            CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof AssetPipelineException) {
            message = "[" + ((AssetPipelineException) ex).getCode() + "] " + message;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText("Asset processing failed: " + message));
        for (Throwable suppressed : ex.getSuppressed()) {
            commandLine.getErr().println("  - " + suppressed.getMessage());
        }
        if (Boolean.getBoolean("docassets.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
