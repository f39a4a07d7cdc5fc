package com.docassets.service;

import com.docassets.exception.AssetProcessingException;
import com.docassets.model.AssetReference;
import com.docassets.model.AssetReference.AssetType;
import com.docassets.util.BuildLogger;
import com.docassets.util.FileUtils;
import com.docassets.util.MimeTypes;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.TreeSet;

/**
 * Walks the content tree ({@code {root}/{locale}/{version}/assets/**}) and collects every
 * image or downloadable file it finds. Read-only.
 */
public class AssetDiscoveryService {

    private static final String ASSETS_DIR = "assets";

    private final Path contentRoot;

    public AssetDiscoveryService(Path contentRoot) {
        this.contentRoot = contentRoot;
    }

    public Path getContentRoot() {
        return contentRoot;
    }

    public List<AssetReference> discoverAssets() {
        return discoverAssets(contentRoot);
    }

    /**
     * Discovers all assets below the given content root.
     *
     * @param root the content root; a missing root yields an empty list
     * @return references sorted by relative path
     * @throws AssetProcessingException if a directory exists but cannot be listed
     */
    public List<AssetReference> discoverAssets(Path root) {
        List<AssetReference> assets = new ArrayList<>();
        if (root == null || !Files.isDirectory(root)) {
            BuildLogger.logInfo("AssetDiscovery", "Content directory not found: " + root);
            return assets;
        }

        for (Path localeDir : listVisibleDirectories(root)) {
            String locale = localeDir.getFileName().toString();
            for (Path versionDir : listVisibleDirectories(localeDir)) {
                String version = versionDir.getFileName().toString();
                Path assetsDir = versionDir.resolve(ASSETS_DIR);
                if (!Files.isDirectory(assetsDir)) {
                    continue;
                }
                collectAssets(root, assetsDir, locale, version, assets);
            }
        }

        assets.sort(Comparator.comparing(AssetReference::getRelativePath));
        BuildLogger.logInfo("AssetDiscovery", "Discovered " + assets.size() + " assets in " + root);
        return assets;
    }

    /**
     * Lists the locale directories and the union of their version directories, both sorted.
     */
    public LocalesAndVersions getAvailableLocalesAndVersions() {
        TreeSet<String> locales = new TreeSet<>();
        TreeSet<String> versions = new TreeSet<>();
        if (contentRoot == null || !Files.isDirectory(contentRoot)) {
            return new LocalesAndVersions(new ArrayList<>(), new ArrayList<>());
        }
        for (Path localeDir : listVisibleDirectories(contentRoot)) {
            locales.add(localeDir.getFileName().toString());
            for (Path versionDir : listVisibleDirectories(localeDir)) {
                versions.add(versionDir.getFileName().toString());
            }
        }
        return new LocalesAndVersions(new ArrayList<>(locales), new ArrayList<>(versions));
    }

    /**
     * Walks one {@code assets} directory. Symbolic links are never followed, so a link can
     * neither loop back into the tree nor pull in a file from outside it.
     */
    private void collectAssets(Path root, Path assetsDir, String locale, String version, List<AssetReference> out) {
        // Explicit work queue instead of recursion, so deep trees cannot overflow the stack
        Deque<Path> pending = new ArrayDeque<>();
        pending.push(assetsDir);

        while (!pending.isEmpty()) {
            Path dir = pending.pop();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                for (Path entry : stream) {
                    String name = entry.getFileName().toString();
                    if (name.startsWith(".")) {
                        continue;
                    }
                    BasicFileAttributes attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                    if (attrs.isSymbolicLink()) {
                        BuildLogger.logWarning("AssetDiscovery", "Skipping symbolic link: " + entry, null);
                    } else if (attrs.isDirectory()) {
                        pending.push(entry);
                    } else if (attrs.isRegularFile()) {
                        AssetType type = MimeTypes.determineAssetTypeFromPath(name);
                        if (type == AssetType.UNKNOWN) {
                            BuildLogger.logDebug("AssetDiscovery", "Skipping unsupported file: " + entry);
                            continue;
                        }
                        String relativePath = FileUtils.toForwardSlashes(root.relativize(entry).toString());
                        out.add(new AssetReference(entry, relativePath, locale, version, type));
                    }
                }
            } catch (IOException e) {
                throw new AssetProcessingException(dir, "Failed to list directory " + dir + ": " + e.getMessage(), e);
            }
        }
    }

    private static List<Path> listVisibleDirectories(Path parent) {
        List<Path> dirs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(parent, Files::isDirectory)) {
            for (Path dir : stream) {
                if (!dir.getFileName().toString().startsWith(".")) {
                    dirs.add(dir);
                }
            }
        } catch (IOException e) {
            throw new AssetProcessingException(parent, "Failed to list directory " + parent + ": " + e.getMessage(), e);
        }
        dirs.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return dirs;
    }

    /**
     * Locale and version directory names found on disk.
     */
    public static class LocalesAndVersions {
        private final List<String> locales;
        private final List<String> versions;

        public LocalesAndVersions(List<String> locales, List<String> versions) {
            this.locales = locales;
            this.versions = versions;
        }

        public List<String> getLocales() { return locales; }
        public List<String> getVersions() { return versions; }
    }
}
