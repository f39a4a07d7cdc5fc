package com.docassets.service;

import com.docassets.exception.AssetValidationException;
import com.docassets.model.AssetManifest;
import com.docassets.model.AssetReference;
import com.docassets.model.AssetReference.AssetType;
import com.docassets.model.ProcessedAsset;
import com.docassets.model.ValidationResult;
import com.docassets.util.BuildLogger;
import com.docassets.util.PipelineSettings;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One build of the asset tree: discover, validate, process, build the manifest, publish.
 * Any validation failure aborts the run before anything is written.
 */
public class AssetPipeline {

    private static final String CONTEXT = "AssetPipeline";

    private final PipelineSettings settings;
    private final AssetDiscoveryService discoveryService;
    private final SecurityValidator validator;
    private final AssetProcessor processor;
    private final ManifestBuilder manifestBuilder;
    private final AssetPublisher publisher;
    private final boolean dryRun;

    public AssetPipeline(PipelineSettings settings, boolean dryRun) {
        this(settings, dryRun, Clock.systemUTC());
    }

    public AssetPipeline(PipelineSettings settings, boolean dryRun, Clock clock) {
        this(settings,
                new AssetDiscoveryService(Paths.get(settings.getContentDir())),
                new SecurityValidator(SecurityOptions.fromSettings(settings)),
                new AssetProcessor(settings.getPublicDir(),
                        new ThumbnailatorImageOptimizer(settings.getPublicDir()),
                        settings.getWorkerThreads()),
                new ManifestBuilder(clock, settings.isSecurityEnabled()),
                new AssetPublisher(Paths.get(settings.getOutputRoot()), settings.getPublicDir(), settings.getWorkerThreads()),
                dryRun);
    }

    public AssetPipeline(PipelineSettings settings, AssetDiscoveryService discoveryService, SecurityValidator validator,
                         AssetProcessor processor, ManifestBuilder manifestBuilder, AssetPublisher publisher,
                         boolean dryRun) {
        this.settings = settings;
        this.discoveryService = discoveryService;
        this.validator = validator;
        this.processor = processor;
        this.manifestBuilder = manifestBuilder;
        this.publisher = publisher;
        this.dryRun = dryRun;
    }

    /**
     * Runs every stage once.
     *
     * @throws AssetValidationException if any asset fails security validation
     * @throws com.docassets.exception.AssetProcessingException if an asset cannot be read
     * @throws com.docassets.exception.AssetPublishException if writing the output fails
     */
    public PipelineReport run() {
        BuildLogger.logInfo(CONTEXT, "Processing static assets from " + discoveryService.getContentRoot()
                + (dryRun ? " (dry run)" : ""));

        // 1. Discover
        List<AssetReference> assets = discoveryService.discoverAssets();
        Map<AssetType, Integer> byType = countByType(assets);
        BuildLogger.logInfo(CONTEXT, "Found " + assets.size() + " assets across "
                + countLocales(assets) + " locales " + byType);

        // 2. Validate
        if (settings.isSecurityEnabled()) {
            validate(assets);
        } else {
            BuildLogger.logWarning(CONTEXT, "Security validation skipped", null);
        }

        // 3. Process
        List<ProcessedAsset> processed = processor.processAssets(assets, processingOptions());
        int derivatives = 0;
        for (ProcessedAsset asset : processed) {
            derivatives += asset.getDerivatives().size();
        }
        BuildLogger.logInfo(CONTEXT, "Processed " + processed.size() + " assets, generated " + derivatives + " variants");

        // 4. Manifest
        AssetManifest manifest = manifestBuilder.generateManifest(processed);

        // 5. Publish
        int written = 0;
        if (!dryRun) {
            written = publisher.copyAssetsToPublicDirectory(processed);
            publisher.writeManifest(manifest);
        }

        BuildLogger.flush();
        BuildLogger.logInfo(CONTEXT, "Asset processing completed: " + processed.size() + " assets, locales "
                + manifest.getLocales() + ", versions " + manifest.getVersions());

        return new PipelineReport(assets.size(), processed.size(), derivatives, written,
                manifest.getLocales(), manifest.getVersions(), byType, publisher.getManifestPath(), dryRun);
    }

    private void validate(List<AssetReference> assets) {
        BuildLogger.logInfo(CONTEXT, "Validating " + assets.size() + " assets for security...");

        Map<String, Path> byRelativePath = new LinkedHashMap<>();
        for (AssetReference asset : assets) {
            byRelativePath.put(asset.getRelativePath(), asset.getSourcePath());
        }
        Map<String, ValidationResult> results = validator.validateAll(byRelativePath);

        List<String> failed = new ArrayList<>();
        results.forEach((path, result) -> {
            if (!result.isValid()) {
                failed.add(path);
                BuildLogger.logError(CONTEXT, path + ": " + String.join("; ", result.getErrors()), null);
            }
        });

        if (!failed.isEmpty()) {
            throw new AssetValidationException(
                    "Asset security validation failed for " + failed.size() + " files", failed);
        }
        BuildLogger.logInfo(CONTEXT, "All assets passed security validation");
    }

    private AssetProcessor.ProcessingOptions processingOptions() {
        return AssetProcessor.ProcessingOptions.defaults()
                .generateResponsiveVariants(settings.isResponsiveVariantsEnabled())
                .generateModernFormats(settings.isModernFormatsEnabled())
                .responsiveOptions(new ImageOptimizer.ResponsiveOptions()
                        .generateRetina(true)
                        .sizes(settings.getResponsiveSizes())
                        .quality(settings.getImageQuality()))
                .modernFormatOptions(new ImageOptimizer.ModernFormatOptions()
                        .webp(true, settings.getImageQuality())
                        .avif(true, settings.getAvifQuality()));
    }

    private static Map<AssetType, Integer> countByType(List<AssetReference> assets) {
        Map<AssetType, Integer> counts = new EnumMap<>(AssetType.class);
        for (AssetReference asset : assets) {
            counts.merge(asset.getType(), 1, Integer::sum);
        }
        return counts;
    }

    private static long countLocales(List<AssetReference> assets) {
        return assets.stream().map(AssetReference::getLocale).distinct().count();
    }
}
