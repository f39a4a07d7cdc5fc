package com.docassets.service;

import com.docassets.model.AssetDerivative;
import com.docassets.model.ImageDimensions;
import com.docassets.model.ProcessedAsset;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Image work the processor delegates: measuring, resizing and re-encoding.
 * Every method may fail independently; callers treat failures as non-fatal.
 */
public interface ImageOptimizer {

    ImageDimensions getImageDimensions(Path image) throws IOException;

    /**
     * Produces resolution variants ("@1x", "@2x", "@{width}w") of an image asset.
     *
     * @return the variants, possibly empty for formats that cannot be resized
     */
    List<AssetDerivative> generateResponsiveVariants(ProcessedAsset image, ResponsiveOptions options) throws IOException;

    /**
     * Re-encodes an image asset into modern formats ("webp", "avif").
     */
    List<AssetDerivative> convertToModernFormats(ProcessedAsset image, ModernFormatOptions options) throws IOException;

    class ResponsiveOptions {
        private boolean generateRetina = true;
        private List<Integer> sizes = new ArrayList<>();
        private int quality = 85;

        public ResponsiveOptions generateRetina(boolean generateRetina) {
            this.generateRetina = generateRetina;
            return this;
        }

        public ResponsiveOptions sizes(List<Integer> sizes) {
            this.sizes = new ArrayList<>(sizes);
            return this;
        }

        public ResponsiveOptions quality(int quality) {
            this.quality = quality;
            return this;
        }

        public boolean isGenerateRetina() { return generateRetina; }
        public List<Integer> getSizes() { return sizes; }
        public int getQuality() { return quality; }
    }

    class ModernFormatOptions {
        private boolean webp = true;
        private int webpQuality = 85;
        private boolean avif = true;
        private int avifQuality = 80;

        public ModernFormatOptions webp(boolean enabled, int quality) {
            this.webp = enabled;
            this.webpQuality = quality;
            return this;
        }

        public ModernFormatOptions avif(boolean enabled, int quality) {
            this.avif = enabled;
            this.avifQuality = quality;
            return this;
        }

        public boolean isWebpEnabled() { return webp; }
        public int getWebpQuality() { return webpQuality; }
        public boolean isAvifEnabled() { return avif; }
        public int getAvifQuality() { return avifQuality; }
    }
}
