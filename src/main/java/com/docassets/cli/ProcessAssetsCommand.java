package com.docassets.cli;

import com.docassets.model.AssetReference.AssetType;
import com.docassets.service.AssetPipeline;
import com.docassets.service.PipelineReport;
import com.docassets.util.BuildLogger;
import com.docassets.util.PipelineSettings;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "doc-assets",
        description = "Discover, validate, hash and publish documentation assets.",
        mixinStandardHelpOptions = true,
        versionProvider = VersionProvider.class,
        showDefaultValues = true
)
public final class ProcessAssetsCommand implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
            names = "--config",
            paramLabel = "FILE",
            description = "Settings file (default: ./" + PipelineSettings.DEFAULT_FILE_NAME + " when present)."
    )
    private Path config;

    @CommandLine.Option(names = "--content-dir", paramLabel = "DIR", description = "Content directory (default: content).")
    private String contentDir;

    @CommandLine.Option(names = "--public-dir", paramLabel = "DIR", description = "Public assets directory (default: public/assets).")
    private String publicDir;

    @CommandLine.Option(names = "--output-root", paramLabel = "DIR", description = "Directory public paths are written under (default: .).")
    private String outputRoot;

    @CommandLine.Option(names = "--default-locale", paramLabel = "LOCALE", description = "Fallback locale (default: en).")
    private String defaultLocale;

    @CommandLine.Option(names = "--skip-security", description = "Skip security validation.")
    private boolean skipSecurity;

    @CommandLine.Option(names = "--skip-responsive", description = "Skip responsive variant generation.")
    private boolean skipResponsive;

    @CommandLine.Option(names = "--skip-modern-formats", description = "Skip modern format conversion (WebP, AVIF).")
    private boolean skipModernFormats;

    @CommandLine.Option(names = "--verbose", description = "Show detailed processing output.")
    private boolean verbose;

    @CommandLine.Option(names = "--dry-run", description = "Process assets but don't write any files.")
    private boolean dryRun;

    @CommandLine.Option(
            names = "--write-config",
            paramLabel = "FILE",
            description = "Write the effective settings to FILE and exit."
    )
    private Path writeConfig;

    @Override
    public Integer call() {
        PipelineSettings settings = loadSettings();
        PrintWriter out = spec.commandLine().getOut();

        if (writeConfig != null) {
            settings.save(writeConfig);
            out.println("Settings written to " + writeConfig);
            out.flush();
            return 0;
        }

        BuildLogger.setDebugEnabled(verbose);
        BuildLogger.configure(dryRun ? null : Paths.get(settings.getOutputRoot()), true);

        PipelineReport report = new AssetPipeline(settings, dryRun).run();
        printSummary(out, report, settings);
        return 0;
    }

    PipelineSettings loadSettings() {
        Path settingsFile = config != null ? config : Paths.get(PipelineSettings.DEFAULT_FILE_NAME);
        if (config != null && !settingsFile.toFile().isFile()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Settings file not found: " + config);
        }
        PipelineSettings settings = PipelineSettings.load(settingsFile);

        if (contentDir != null) settings.setContentDir(contentDir);
        if (publicDir != null) settings.setPublicDir(publicDir);
        if (outputRoot != null) settings.setOutputRoot(outputRoot);
        if (defaultLocale != null) settings.setDefaultLocale(defaultLocale);
        if (skipSecurity) settings.setSecurityEnabled(false);
        if (skipResponsive) settings.setResponsiveVariantsEnabled(false);
        if (skipModernFormats) settings.setModernFormatsEnabled(false);
        return settings;
    }

    private static void printSummary(PrintWriter out, PipelineReport report, PipelineSettings settings) {
        out.println();
        out.println(report.isDryRun() ? "Asset processing completed (dry run, nothing written)." : "Asset processing completed successfully!");
        out.println("Summary:");
        out.println("  Processed: " + report.getProcessed() + " assets");
        for (Map.Entry<AssetType, Integer> entry : report.getAssetsByType().entrySet()) {
            out.println("    " + entry.getKey().label() + ": " + entry.getValue());
        }
        if (report.getDerivatives() > 0) {
            out.println("  Variants: " + report.getDerivatives());
        }
        out.println("  Locales: " + String.join(", ", report.getLocales()));
        out.println("  Versions: " + String.join(", ", report.getVersions()));
        out.println("  Output: " + Paths.get(settings.getOutputRoot()).resolve(settings.getPublicDir()));
        out.println("  Manifest: " + report.getManifestPath());
        out.flush();
    }
}
