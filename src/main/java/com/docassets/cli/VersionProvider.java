package com.docassets.cli;

import picocli.CommandLine;

/**
 * Reports the jar's implementation version, or "development" when run from classes.
 */
public final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = VersionProvider.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        return new String[] { "doc-assets " + version };
    }
}
