package com.docassets;

import com.docassets.cli.ProcessAssetsCommand;
import com.docassets.cli.ShortErrorHandler;
import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Launcher {
    private Launcher() {}

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    public static CommandLine createCommandLine() {
        return new CommandLine(new ProcessAssetsCommand())
                .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
