package com.docassets.service;

import com.docassets.util.MimeTypes;
import com.docassets.util.PipelineSettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for {@link SecurityValidator}. Defaults: 10 MB size limit, the standard
 * image and binary allow-lists, content scanning on, strict path validation on.
 */
public class SecurityOptions {
    private long maxFileSize = PipelineSettings.DEFAULT_MAX_FILE_SIZE;
    private List<String> allowedImageTypes = new ArrayList<>(MimeTypes.ALLOWED_IMAGE_TYPES);
    private List<String> allowedBinaryTypes = new ArrayList<>(MimeTypes.ALLOWED_BINARY_TYPES);
    private boolean enableContentScanning = true;
    private boolean strictPathValidation = true;
    private int workerThreads = Math.max(1, Runtime.getRuntime().availableProcessors());

    public static SecurityOptions defaults() {
        return new SecurityOptions();
    }

    public static SecurityOptions fromSettings(PipelineSettings settings) {
        boolean enabled = settings.isSecurityEnabled();
        return new SecurityOptions()
                .maxFileSize(settings.getMaxFileSize())
                .enableContentScanning(enabled)
                .strictPathValidation(enabled)
                .workerThreads(settings.getWorkerThreads());
    }

    public SecurityOptions maxFileSize(long maxFileSize) {
        this.maxFileSize = maxFileSize;
        return this;
    }

    public SecurityOptions allowedImageTypes(List<String> types) {
        this.allowedImageTypes = new ArrayList<>(types);
        return this;
    }

    public SecurityOptions allowedBinaryTypes(List<String> types) {
        this.allowedBinaryTypes = new ArrayList<>(types);
        return this;
    }

    public SecurityOptions enableContentScanning(boolean enabled) {
        this.enableContentScanning = enabled;
        return this;
    }

    public SecurityOptions strictPathValidation(boolean strict) {
        this.strictPathValidation = strict;
        return this;
    }

    public SecurityOptions workerThreads(int threads) {
        this.workerThreads = Math.max(1, threads);
        return this;
    }

    public long getMaxFileSize() { return maxFileSize; }
    public List<String> getAllowedImageTypes() { return allowedImageTypes; }
    public List<String> getAllowedBinaryTypes() { return allowedBinaryTypes; }
    public boolean isContentScanningEnabled() { return enableContentScanning; }
    public boolean isStrictPathValidation() { return strictPathValidation; }
    public int getWorkerThreads() { return workerThreads; }
}
