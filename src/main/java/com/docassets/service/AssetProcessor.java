package com.docassets.service;

import com.docassets.exception.AssetErrorCode;
import com.docassets.exception.AssetPipelineException;
import com.docassets.exception.AssetProcessingException;
import com.docassets.model.AssetDerivative;
import com.docassets.model.AssetManifest;
import com.docassets.model.AssetReference;
import com.docassets.model.AssetReference.AssetType;
import com.docassets.model.ManifestEntry;
import com.docassets.model.ProcessedAsset;
import com.docassets.util.BuildLogger;
import com.docassets.util.FileUtils;
import com.docassets.util.ManifestJson;
import com.docassets.util.MimeTypes;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Turns discovered {@link AssetReference}s into content-addressed {@link ProcessedAsset}s.
 * The output depends only on the file bytes, its place in the content tree and its
 * modification time, so repeated runs over an unchanged tree produce identical names.
 */
public class AssetProcessor {

    private final String publicDir;
    private final ImageOptimizer imageOptimizer;
    private final int workerThreads;

    public AssetProcessor(String publicDir) {
        this(publicDir, new ThumbnailatorImageOptimizer(publicDir), Runtime.getRuntime().availableProcessors());
    }

    public AssetProcessor(String publicDir, ImageOptimizer imageOptimizer, int workerThreads) {
        this.publicDir = publicDir;
        this.imageOptimizer = imageOptimizer;
        this.workerThreads = Math.max(1, workerThreads);
    }

    /**
     * @return SHA-256 of the content as 64 lowercase hex characters
     */
    public String generateContentHash(byte[] content) {
        return FileUtils.sha256Hex(content);
    }

    /**
     * Builds {@code /{publicDir}/{locale}/{version}/{images|files}/{filename}}.
     */
    public String generateScopedAssetPath(String locale, String version, AssetType type, String filename) {
        return FileUtils.joinUrlPath(publicDir, locale, version, MimeTypes.typeDirectory(type), filename);
    }

    public ProcessedAsset processAsset(AssetReference asset) {
        return processAsset(asset, ProcessingOptions.defaults());
    }

    /**
     * Hashes one asset and, for images, asks the optimizer for dimensions and variants.
     * Optimizer failures are logged and leave the asset without that information.
     *
     * @throws AssetProcessingException if the file cannot be read
     */
    public ProcessedAsset processAsset(AssetReference asset, ProcessingOptions options) {
        Path source = asset.getSourcePath();
        BasicFileAttributes attrs;
        byte[] content;
        try {
            attrs = Files.readAttributes(source, BasicFileAttributes.class);
            content = Files.readAllBytes(source);
        } catch (IOException e) {
            throw new AssetProcessingException(source, "Failed to process asset " + source + ": " + e.getMessage(), e);
        }

        String contentHash = generateContentHash(content);
        String fileName = FileUtils.getFileName(asset.getRelativePath());
        String hashedFilename = FileUtils.getBaseName(fileName) + "." + contentHash.substring(0, 8)
                + FileUtils.getDottedExtension(fileName);
        String publicPath = generateScopedAssetPath(asset.getLocale(), asset.getVersion(), asset.getType(), hashedFilename);
        String lastModified = ManifestJson.timestamp(attrs.lastModifiedTime().toInstant());

        ProcessedAsset processed = new ProcessedAsset(asset, publicPath, hashedFilename, contentHash,
                content.length, MimeTypes.getMimeType(fileName), lastModified);

        if (asset.getType() == AssetType.IMAGE) {
            optimize(processed, options);
        }

        BuildLogger.logDebug("AssetProcessor", "Processed " + asset.getRelativePath() + " -> " + publicPath);
        return processed;
    }

    /**
     * Processes a batch in parallel. The result list has the same order as the input.
     * Every asset is attempted; the first failure is rethrown once all have finished.
     */
    public List<ProcessedAsset> processAssets(List<AssetReference> assets, ProcessingOptions options) {
        List<ProcessedAsset> results = new ArrayList<>(assets.size());
        if (assets.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workerThreads, assets.size()));
        try {
            List<Future<ProcessedAsset>> futures = new ArrayList<>(assets.size());
            for (AssetReference asset : assets) {
                futures.add(executor.submit(() -> processAsset(asset, options)));
            }

            AssetPipelineException firstFailure = null;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    AssetPipelineException failure = toProcessingException(assets.get(i), e.getCause());
                    BuildLogger.logError("AssetProcessor", failure.getMessage(), failure.getCause());
                    if (firstFailure == null) {
                        firstFailure = failure;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new AssetPipelineException(AssetErrorCode.CANCELLED, "Asset processing interrupted", e);
                }
            }

            if (firstFailure != null) {
                throw firstFailure;
            }
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    /**
     * Resolves the public URL for a content-relative path.
     * Without a manifest the unhashed scoped path is constructed from the file name.
     * With one, an entry for exactly this locale and version wins; otherwise any entry with
     * the same original path that shares the locale or the version.
     *
     * @return the public path, or null when the manifest has no usable entry
     */
    public String resolveAssetUrl(String relativePath, String locale, String version, AssetManifest manifest) {
        String normalized = FileUtils.toForwardSlashes(relativePath);
        if (manifest == null) {
            String filename = FileUtils.getFileName(normalized);
            AssetType type = MimeTypes.determineAssetTypeFromPath(filename);
            return generateScopedAssetPath(locale, version, type, filename);
        }

        ManifestEntry entry = manifest.getEntry(normalized);
        if (entry != null && entry.belongsTo(locale, version)) {
            return entry.getPublicPath();
        }

        for (ManifestEntry candidate : manifest.getAssets().values()) {
            if (normalized.equals(candidate.getOriginalPath())
                    && (locale.equals(candidate.getLocale()) || version.equals(candidate.getVersion()))) {
                return candidate.getPublicPath();
            }
        }
        return null;
    }

    private void optimize(ProcessedAsset processed, ProcessingOptions options) {
        String path = processed.getRelativePath();
        try {
            processed.setDimensions(imageOptimizer.getImageDimensions(processed.getSourcePath()));
        } catch (IOException | RuntimeException e) {
            BuildLogger.logWarning("AssetProcessor", "Failed to get dimensions for " + path + ": " + e.getMessage(), null);
        }

        if (options.isGenerateResponsiveVariants()) {
            try {
                List<AssetDerivative> variants = imageOptimizer.generateResponsiveVariants(processed, options.getResponsiveOptions());
                processed.addDerivatives(variants);
            } catch (IOException | RuntimeException e) {
                BuildLogger.logWarning("AssetProcessor", "Failed to generate responsive variants for " + path + ": " + e.getMessage(), null);
            }
        }

        if (options.isGenerateModernFormats()) {
            try {
                List<AssetDerivative> formats = imageOptimizer.convertToModernFormats(processed, options.getModernFormatOptions());
                processed.addDerivatives(formats);
            } catch (IOException | RuntimeException e) {
                // Usually a missing encoder, identical for every image
                BuildLogger.logRecurringWarning("AssetProcessor", "Failed to generate modern format variants: " + e.getMessage(), null);
            }
        }
    }

    private static AssetPipelineException toProcessingException(AssetReference asset, Throwable cause) {
        if (cause instanceof AssetPipelineException) {
            return (AssetPipelineException) cause;
        }
        return new AssetProcessingException(asset.getSourcePath(),
                "Failed to process asset " + asset.getSourcePath() + ": " + cause.getMessage(), cause);
    }

    /**
     * Which optional image work {@link #processAsset(AssetReference, ProcessingOptions)} performs.
     */
    public static class ProcessingOptions {
        private boolean generateResponsiveVariants = true;
        private boolean generateModernFormats = true;
        private ImageOptimizer.ResponsiveOptions responsiveOptions = new ImageOptimizer.ResponsiveOptions();
        private ImageOptimizer.ModernFormatOptions modernFormatOptions = new ImageOptimizer.ModernFormatOptions();

        public static ProcessingOptions defaults() {
            return new ProcessingOptions();
        }

        /**
         * Hashing only, no image work beyond reading dimensions.
         */
        public static ProcessingOptions hashOnly() {
            return new ProcessingOptions().generateResponsiveVariants(false).generateModernFormats(false);
        }

        public ProcessingOptions generateResponsiveVariants(boolean enabled) {
            this.generateResponsiveVariants = enabled;
            return this;
        }

        public ProcessingOptions generateModernFormats(boolean enabled) {
            this.generateModernFormats = enabled;
            return this;
        }

        public ProcessingOptions responsiveOptions(ImageOptimizer.ResponsiveOptions options) {
            this.responsiveOptions = options;
            return this;
        }

        public ProcessingOptions modernFormatOptions(ImageOptimizer.ModernFormatOptions options) {
            this.modernFormatOptions = options;
            return this;
        }

        public boolean isGenerateResponsiveVariants() { return generateResponsiveVariants; }
        public boolean isGenerateModernFormats() { return generateModernFormats; }
        public ImageOptimizer.ResponsiveOptions getResponsiveOptions() { return responsiveOptions; }
        public ImageOptimizer.ModernFormatOptions getModernFormatOptions() { return modernFormatOptions; }
    }
}
