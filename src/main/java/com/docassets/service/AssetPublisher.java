package com.docassets.service;

import com.docassets.exception.AssetErrorCode;
import com.docassets.exception.AssetPipelineException;
import com.docassets.exception.AssetPublishException;
import com.docassets.model.AssetDerivative;
import com.docassets.model.AssetManifest;
import com.docassets.model.ProcessedAsset;
import com.docassets.util.BuildLogger;
import com.docassets.util.ManifestJson;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Writes processed assets and the manifest into the output tree.
 * Public paths are resolved against the output root, so {@code /public/assets/en/v1/images/a.1234abcd.png}
 * lands at {@code {outputRoot}/public/assets/en/v1/images/a.1234abcd.png}.
 */
public class AssetPublisher {

    private final Path outputRoot;
    private final String publicDir;
    private final int workerThreads;

    public AssetPublisher(Path outputRoot, String publicDir) {
        this(outputRoot, publicDir, Runtime.getRuntime().availableProcessors());
    }

    public AssetPublisher(Path outputRoot, String publicDir, int workerThreads) {
        this.outputRoot = outputRoot;
        this.publicDir = publicDir;
        this.workerThreads = Math.max(1, workerThreads);
    }

    public Path getManifestPath() {
        return outputRoot.resolve(publicDir).resolve(AssetManifest.FILE_NAME);
    }

    /**
     * Resolves a public URL path against the output root.
     */
    public Path toOutputPath(String publicPath) {
        String relative = publicPath;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        return outputRoot.resolve(relative);
    }

    /**
     * Copies every asset (and writes any encoded derivative) to its public location.
     * All assets are attempted; failures are reported together.
     *
     * @return the number of files written
     * @throws AssetPublishException with one suppressed exception per failed asset
     */
    public int copyAssetsToPublicDirectory(List<ProcessedAsset> assets) {
        if (assets.isEmpty()) {
            return 0;
        }

        // Same public path means same name and same bytes, so one copy is enough
        Map<String, ProcessedAsset> byTarget = new LinkedHashMap<>();
        for (ProcessedAsset asset : assets) {
            byTarget.putIfAbsent(asset.getPublicPath(), asset);
        }
        List<ProcessedAsset> unique = new ArrayList<>(byTarget.values());

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workerThreads, unique.size()));
        List<AssetPublishException> failures = new ArrayList<>();
        int written = 0;
        try {
            List<Future<Integer>> futures = new ArrayList<>(unique.size());
            for (ProcessedAsset asset : unique) {
                futures.add(executor.submit(() -> publishAsset(asset)));
            }

            for (int i = 0; i < futures.size(); i++) {
                try {
                    written += futures.get(i).get();
                } catch (ExecutionException e) {
                    ProcessedAsset asset = unique.get(i);
                    Throwable cause = e.getCause();
                    AssetPublishException failure = cause instanceof AssetPublishException
                            ? (AssetPublishException) cause
                            : new AssetPublishException("Failed to copy asset " + asset.getSourcePath()
                            + " to " + asset.getPublicPath() + ": " + cause.getMessage(), asset.getPublicPath(), cause);
                    BuildLogger.logError("AssetPublisher", failure.getMessage(), null);
                    failures.add(failure);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new AssetPipelineException(AssetErrorCode.CANCELLED, "Asset publishing interrupted", e);
                }
            }
        } finally {
            executor.shutdownNow();
        }

        if (!failures.isEmpty()) {
            AssetPublishException aggregate = new AssetPublishException(
                    "Failed to publish " + failures.size() + " of " + unique.size() + " assets");
            failures.forEach(aggregate::addSuppressed);
            throw aggregate;
        }

        BuildLogger.logInfo("AssetPublisher", "Published " + written + " files to " + outputRoot.resolve(publicDir));
        return written;
    }

    /**
     * Writes the manifest as pretty JSON. The file is written next to its destination and
     * moved into place, so readers see either the old or the new manifest.
     *
     * @return the manifest path
     */
    public Path writeManifest(AssetManifest manifest) {
        Path target = getManifestPath();
        try {
            Files.createDirectories(target.getParent());
            writeAtomically(target, ManifestJson.prettyWriter().writeValueAsBytes(manifest));
        } catch (IOException e) {
            throw new AssetPublishException("Failed to write asset manifest " + target + ": " + e.getMessage(),
                    target.toString(), e);
        }
        BuildLogger.logInfo("AssetPublisher", "Wrote manifest with " + manifest.getAssets().size() + " entries to " + target);
        return target;
    }

    private int publishAsset(ProcessedAsset asset) throws IOException {
        Path target = toOutputPath(asset.getPublicPath());
        Files.createDirectories(target.getParent());
        Path tempFile = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.copy(asset.getSourcePath(), tempFile, StandardCopyOption.REPLACE_EXISTING);
            moveIntoPlace(tempFile, target);
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw e;
        }
        int written = 1;

        for (AssetDerivative derivative : asset.getDerivatives()) {
            if (!derivative.hasContent()) {
                continue;
            }
            Path derivativeTarget = toOutputPath(derivative.getPublicPath());
            try {
                Files.createDirectories(derivativeTarget.getParent());
                writeAtomically(derivativeTarget, derivative.getContent());
                written++;
            } catch (IOException e) {
                throw new AssetPublishException("Failed to write derivative " + derivative.getVariant() + " of "
                        + asset.getRelativePath() + ": " + e.getMessage(), derivative.getPublicPath(), e);
            }
        }
        return written;
    }

    /**
     * Writes next to the target and moves into place, so concurrent writers of the same
     * target never observe a half-written or missing file.
     */
    private static void writeAtomically(Path target, byte[] content) throws IOException {
        Path tempFile = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(tempFile, content);
            moveIntoPlace(tempFile, target);
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw e;
        }
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            BuildLogger.logWarning("AssetPublisher", "Could not remove temporary file " + file, e);
        }
    }
}
