package com.docassets.util;

import com.docassets.exception.ConfigException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Build settings for the asset pipeline.
 * Read from an optional JSON file ({@value #DEFAULT_FILE_NAME}); every key has a
 * default, so a missing file simply means "all defaults". Values set through the
 * setters (CLI overrides) are kept in the same tree and can be saved back.
 * Uses Jackson for JSON serialization/deserialization.
 */
public class PipelineSettings {

    public static final String DEFAULT_FILE_NAME = "asset-pipeline.json";
    public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024; // 10 MB

    private final ObjectMapper mapper;
    private final ObjectNode rootNode;

    private PipelineSettings(ObjectMapper mapper, ObjectNode rootNode) {
        this.mapper = mapper;
        this.rootNode = rootNode;
    }

    /**
     * @return settings with every value at its default.
     */
    public static PipelineSettings defaults() {
        ObjectMapper mapper = new ObjectMapper();
        return new PipelineSettings(mapper, mapper.createObjectNode());
    }

    /**
     * Loads settings from a JSON file. A null or missing file yields the defaults.
     *
     * @throws ConfigException if the file exists but is unreadable or not a JSON object
     */
    public static PipelineSettings load(Path settingsFile) {
        ObjectMapper mapper = new ObjectMapper();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return new PipelineSettings(mapper, mapper.createObjectNode());
        }
        try {
            JsonNode node = mapper.readTree(settingsFile.toFile());
            if (node == null || node.isMissingNode()) {
                return new PipelineSettings(mapper, mapper.createObjectNode());
            }
            if (!node.isObject()) {
                throw new ConfigException("Settings file must contain a JSON object: " + settingsFile);
            }
            return new PipelineSettings(mapper, (ObjectNode) node);
        } catch (IOException e) {
            throw new ConfigException("Failed to read settings file " + settingsFile + ": " + e.getMessage(), e);
        }
    }

    public void save(Path settingsFile) {
        try {
            Path parent = settingsFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(settingsFile.toFile(), rootNode);
        } catch (IOException e) {
            throw new ConfigException("Failed to write settings file " + settingsFile + ": " + e.getMessage(), e);
        }
    }

    // --- Layout ---

    public String getContentDir() {
        return text("content_dir", "content");
    }

    public void setContentDir(String contentDir) {
        rootNode.put("content_dir", contentDir);
    }

    /**
     * @return the public assets directory, relative to the output root (e.g. "public/assets").
     */
    public String getPublicDir() {
        return text("public_dir", "public/assets");
    }

    public void setPublicDir(String publicDir) {
        rootNode.put("public_dir", publicDir);
    }

    /**
     * @return the directory public paths are resolved against when files are written.
     */
    public String getOutputRoot() {
        return text("output_root", ".");
    }

    public void setOutputRoot(String outputRoot) {
        rootNode.put("output_root", outputRoot);
    }

    // --- Locales and versions ---

    public String getDefaultLocale() {
        return text("default_locale", "en");
    }

    public void setDefaultLocale(String locale) {
        rootNode.put("default_locale", locale);
    }

    public List<String> getLocales() {
        List<String> locales = new ArrayList<>();
        JsonNode array = rootNode.get("locales");
        if (array != null && array.isArray()) {
            for (JsonNode node : array) {
                locales.add(node.asText());
            }
        }
        // Defaults if not found
        if (locales.isEmpty()) {
            locales.add("en");
            locales.add("es");
            locales.add("pt");
        }
        return locales;
    }

    public void setLocales(List<String> locales) {
        ArrayNode array = mapper.createArrayNode();
        locales.forEach(array::add);
        rootNode.set("locales", array);
    }

    public String getDefaultVersion() {
        return text("default_version", "v1");
    }

    // --- Security ---

    public long getMaxFileSize() {
        long value = rootNode.has("max_file_size") ? rootNode.get("max_file_size").asLong() : DEFAULT_MAX_FILE_SIZE;
        if (value <= 0) {
            throw new ConfigException("max_file_size must be positive, got " + value);
        }
        return value;
    }

    public void setMaxFileSize(long maxFileSize) {
        rootNode.put("max_file_size", maxFileSize);
    }

    public boolean isSecurityEnabled() {
        return bool("enable_security", true);
    }

    public void setSecurityEnabled(boolean enabled) {
        rootNode.put("enable_security", enabled);
    }

    // --- Image optimization ---

    public boolean isResponsiveVariantsEnabled() {
        return bool("generate_responsive_variants", true);
    }

    public void setResponsiveVariantsEnabled(boolean enabled) {
        rootNode.put("generate_responsive_variants", enabled);
    }

    public boolean isModernFormatsEnabled() {
        return bool("generate_modern_formats", true);
    }

    public void setModernFormatsEnabled(boolean enabled) {
        rootNode.put("generate_modern_formats", enabled);
    }

    public int getImageQuality() {
        return percent("image_quality", 85);
    }

    public int getAvifQuality() {
        return percent("avif_quality", 80);
    }

    public List<Integer> getResponsiveSizes() {
        List<Integer> sizes = new ArrayList<>();
        JsonNode array = rootNode.get("responsive_sizes");
        if (array != null && array.isArray()) {
            for (JsonNode node : array) {
                if (node.canConvertToInt() && node.asInt() > 0) {
                    sizes.add(node.asInt());
                }
            }
        }
        return sizes;
    }

    // --- Execution ---

    public int getWorkerThreads() {
        int fallback = Math.max(1, Runtime.getRuntime().availableProcessors());
        if (!rootNode.has("worker_threads")) {
            return fallback;
        }
        int value = rootNode.get("worker_threads").asInt(fallback);
        return value > 0 ? value : fallback;
    }

    public void setWorkerThreads(int threads) {
        rootNode.put("worker_threads", threads);
    }

    private String text(String key, String fallback) {
        if (rootNode.has(key) && !rootNode.get(key).isNull()) {
            String value = rootNode.get(key).asText();
            if (!value.isBlank()) {
                return value;
            }
        }
        return fallback;
    }

    private boolean bool(String key, boolean fallback) {
        if (rootNode.has(key)) {
            return rootNode.get(key).asBoolean(fallback);
        }
        return fallback;
    }

    private int percent(String key, int fallback) {
        if (!rootNode.has(key)) {
            return fallback;
        }
        int value = rootNode.get(key).asInt(fallback);
        if (value < 1 || value > 100) {
            throw new ConfigException(key + " must be between 1 and 100, got " + value);
        }
        return value;
    }
}
