package com.docassets.service;

import com.docassets.model.AssetAvailability;
import com.docassets.model.AssetContext;
import com.docassets.model.AssetManifest;
import com.docassets.model.AssetReference.AssetType;
import com.docassets.model.AssetResolutionResult;
import com.docassets.model.AssetResolutionResult.FallbackType;
import com.docassets.model.ManifestEntry;
import com.docassets.util.FileUtils;
import com.docassets.util.MimeTypes;
import com.docassets.util.PipelineSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a logical asset reference from a page ({@code "logo.png"}, {@code "images/logo.png"})
 * to its published path, given the page's locale and version.
 * <p>
 * Lookup order, first hit wins:
 * <ol>
 *     <li>the page's own locale and version</li>
 *     <li>the same locale, any other version (sorted)</li>
 *     <li>the default locale, same version</li>
 *     <li>the default locale, any version (sorted)</li>
 * </ol>
 * Stateless and read-only; safe to share between threads.
 */
public class AssetContextResolver {

    private static final Pattern VERSION_SEGMENT = Pattern.compile("/v(\\d+)");

    private final String defaultLocale;
    private final String defaultVersion;
    private final List<String> supportedLocales;
    private final String publicDir;

    public AssetContextResolver(String defaultLocale, String defaultVersion, List<String> supportedLocales, String publicDir) {
        this.defaultLocale = defaultLocale;
        this.defaultVersion = defaultVersion;
        this.supportedLocales = List.copyOf(supportedLocales);
        this.publicDir = publicDir;
    }

    public static AssetContextResolver fromSettings(PipelineSettings settings) {
        return new AssetContextResolver(settings.getDefaultLocale(), settings.getDefaultVersion(),
                settings.getLocales(), settings.getPublicDir());
    }

    public String getDefaultLocale() {
        return defaultLocale;
    }

    /**
     * Resolves {@code src} for the given context.
     *
     * @param manifest the published manifest, never null; use {@link #resolveOrDirect} without one
     * @return the match and the tier that produced it, or empty when no tier has the asset
     */
    public Optional<AssetResolutionResult> resolve(String src, AssetContext context, AssetManifest manifest) {
        Objects.requireNonNull(manifest, "manifest is required to resolve " + src);
        String normalizedSrc = normalize(src);

        for (Candidate candidate : buildCandidates(context, manifest)) {
            ManifestEntry entry = findEntry(normalizedSrc, candidate.locale, candidate.version, manifest);
            if (entry != null) {
                return Optional.of(candidate.fallbackType == null
                        ? AssetResolutionResult.exact(entry)
                        : AssetResolutionResult.fallback(entry, candidate.fallbackType));
            }
        }
        return Optional.empty();
    }

    /**
     * Like {@link #resolve}, but degrades to the unhashed direct path when nothing matches.
     * A direct result has no entry and the path may not exist at serve time.
     */
    public AssetResolutionResult resolveOrDirect(String src, AssetContext context, AssetManifest manifest) {
        if (manifest == null) {
            return AssetResolutionResult.direct(generateDirectAssetPath(src, context));
        }
        return resolve(src, context, manifest)
                .orElseGet(() -> AssetResolutionResult.direct(generateDirectAssetPath(src, context)));
    }

    /**
     * Guesses {@code /{publicDir}/{locale}/{version}/{images|files}/{filename}} without a manifest.
     */
    public String generateDirectAssetPath(String src, AssetContext context) {
        String filename = FileUtils.getFileName(normalize(src));
        if (filename.isEmpty()) {
            filename = "unknown";
        }
        AssetType type = MimeTypes.determineAssetTypeFromPath(filename) == AssetType.IMAGE ? AssetType.IMAGE : AssetType.BINARY;
        return FileUtils.joinUrlPath(publicDir, context.getLocale(), context.getVersion(),
                MimeTypes.typeDirectory(type), filename);
    }

    /**
     * @return every locale × version pair the manifest knows about
     */
    public List<AssetContext> getAllPossibleContexts(AssetManifest manifest) {
        List<AssetContext> contexts = new ArrayList<>();
        for (String locale : manifest.getLocales()) {
            for (String version : manifest.getVersions()) {
                contexts.add(new AssetContext(locale, version));
            }
        }
        return contexts;
    }

    /**
     * Exact-tier check only: no fallback is considered.
     */
    public boolean assetExistsInContext(String src, AssetContext context, AssetManifest manifest) {
        return findEntry(normalize(src), context.getLocale(), context.getVersion(), manifest) != null;
    }

    public List<AssetAvailability> getAssetAvailability(String src, AssetManifest manifest) {
        List<AssetAvailability> availability = new ArrayList<>();
        for (AssetContext context : getAllPossibleContexts(manifest)) {
            availability.add(new AssetAvailability(context, assetExistsInContext(src, context, manifest)));
        }
        return availability;
    }

    /**
     * Derives the context of a request path such as {@code /es/docs/v2/guide}: the locale is
     * the first segment when supported (else the default locale), the version is the first
     * {@code /v<digits>} segment (else the default version).
     */
    public AssetContext getAssetContextFromPathname(String pathname) {
        String path = pathname == null ? "" : FileUtils.toForwardSlashes(pathname);

        String locale = defaultLocale;
        for (String segment : path.split("/")) {
            if (segment.isEmpty()) continue;
            if (supportedLocales.contains(segment)) {
                locale = segment;
            }
            break;
        }

        Matcher matcher = VERSION_SEGMENT.matcher(path);
        String version = matcher.find() ? "v" + matcher.group(1) : defaultVersion;
        return new AssetContext(locale, version);
    }

    private List<Candidate> buildCandidates(AssetContext context, AssetManifest manifest) {
        List<Candidate> candidates = new ArrayList<>();
        String locale = context.getLocale();
        String version = context.getVersion();

        candidates.add(new Candidate(locale, version, null));

        for (String other : manifest.getVersions()) {
            if (!other.equals(version)) {
                candidates.add(new Candidate(locale, other, FallbackType.VERSION));
            }
        }

        if (!locale.equals(defaultLocale)) {
            candidates.add(new Candidate(defaultLocale, version, FallbackType.LOCALE));
        }

        for (String any : manifest.getVersions()) {
            candidates.add(new Candidate(defaultLocale, any, FallbackType.LOCALE));
        }
        return candidates;
    }

    private static ManifestEntry findEntry(String normalizedSrc, String locale, String version, AssetManifest manifest) {
        String prefix = locale + "/" + version + "/assets/";
        String[] keys = {
                prefix + normalizedSrc,
                prefix + "images/" + normalizedSrc,
                prefix + "files/" + normalizedSrc,
                normalizedSrc
        };
        for (String key : keys) {
            ManifestEntry entry = manifest.getEntry(key);
            if (entry != null && entry.belongsTo(locale, version)) {
                return entry;
            }
        }
        return null;
    }

    private static String normalize(String src) {
        if (src == null) {
            return "";
        }
        return src.startsWith("/") ? src.substring(1) : src;
    }

    private static final class Candidate {
        private final String locale;
        private final String version;
        private final FallbackType fallbackType; // null for the exact tier

        private Candidate(String locale, String version, FallbackType fallbackType) {
            this.locale = locale;
            this.version = version;
            this.fallbackType = fallbackType;
        }
    }
}
