package com.docassets.service;

import com.docassets.model.AssetDerivative;
import com.docassets.model.AssetReference.AssetType;
import com.docassets.model.ImageDimensions;
import com.docassets.model.ProcessedAsset;
import com.docassets.util.BuildLogger;
import com.docassets.util.FileUtils;
import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.gif.GifHeaderDirectory;
import com.drew.metadata.jpeg.JpegDirectory;
import com.drew.metadata.png.PngDirectory;
import com.drew.metadata.webp.WebpDirectory;
import net.coobird.thumbnailator.Thumbnails;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ImageOptimizer} backed by Thumbnailator for resizing, metadata-extractor for
 * reading dimensions from headers, and whatever ImageIO plugins are on the classpath
 * for decoding and re-encoding.
 */
public class ThumbnailatorImageOptimizer implements ImageOptimizer {

    private static final String SVG_EXTENSION = "svg";
    private static final int RETINA_MULTIPLIER = 2;

    // ImageIO format names for extensions we can re-encode in place
    private static final Map<String, String> OUTPUT_FORMATS = Map.of(
            "jpg", "jpg",
            "jpeg", "jpg",
            "png", "png",
            "gif", "gif"
    );

    private static final Pattern SVG_WIDTH = Pattern.compile("<svg[^>]*\\swidth=\"(\\d+)(?:px)?\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern SVG_HEIGHT = Pattern.compile("<svg[^>]*\\sheight=\"(\\d+)(?:px)?\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern SVG_VIEWBOX = Pattern.compile(
            "viewBox=\"\\s*[-\\d.]+[\\s,]+[-\\d.]+[\\s,]+([\\d.]+)[\\s,]+([\\d.]+)\\s*\"", Pattern.CASE_INSENSITIVE);

    private final String publicDir;

    public ThumbnailatorImageOptimizer(String publicDir) {
        this.publicDir = publicDir;
    }

    @Override
    public ImageDimensions getImageDimensions(Path image) throws IOException {
        String extension = FileUtils.getExtension(String.valueOf(image.getFileName()));
        if (SVG_EXTENSION.equals(extension)) {
            return readSvgDimensions(image);
        }

        // 1. Try header metadata
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(image.toFile());
            ImageDimensions fromHeaders = readDimensions(metadata);
            if (fromHeaders != null) {
                return fromHeaders;
            }
        } catch (ImageProcessingException e) {
            BuildLogger.logDebug("ImageOptimizer", "No readable metadata in " + image + ": " + e.getMessage());
        }

        // 2. Fallback to an ImageIO reader, without decoding pixels
        try (ImageInputStream in = ImageIO.createImageInputStream(image.toFile())) {
            if (in != null) {
                Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
                if (readers.hasNext()) {
                    ImageReader reader = readers.next();
                    try {
                        reader.setInput(in);
                        return new ImageDimensions(reader.getWidth(0), reader.getHeight(0));
                    } finally {
                        reader.dispose();
                    }
                }
            }
        }
        throw new IOException("Unable to determine image dimensions for " + image);
    }

    /**
     * The source file is treated as the high-density master: "@2x" is the source
     * re-encoded at its own size and "@1x" is half of it. Custom widths are only
     * produced when smaller than the source.
     */
    @Override
    public List<AssetDerivative> generateResponsiveVariants(ProcessedAsset image, ResponsiveOptions options) throws IOException {
        requireImage(image);
        List<AssetDerivative> derivatives = new ArrayList<>();

        String extension = FileUtils.getExtension(image.getRelativePath());
        String format = OUTPUT_FORMATS.get(extension);
        if (format == null) {
            BuildLogger.logDebug("ImageOptimizer", "No responsive variants for ." + extension + " files: " + image.getRelativePath());
            return derivatives;
        }

        BufferedImage source = ImageIO.read(image.getSourcePath().toFile());
        if (source == null) {
            BuildLogger.logDebug("ImageOptimizer", "ImageIO cannot decode " + image.getRelativePath());
            return derivatives;
        }

        int width = source.getWidth();
        int height = source.getHeight();
        String dottedExtension = FileUtils.getDottedExtension(image.getRelativePath());

        int halfWidth = width / RETINA_MULTIPLIER;
        int halfHeight = height / RETINA_MULTIPLIER;
        if (halfWidth >= 1 && halfHeight >= 1) {
            byte[] bytes = resize(source, halfWidth, halfHeight, format, options.getQuality());
            derivatives.add(createDerivative(image, bytes, "@1x", new ImageDimensions(halfWidth, halfHeight), dottedExtension));
        }

        if (options.isGenerateRetina()) {
            byte[] bytes = resize(source, width, height, format, options.getQuality());
            derivatives.add(createDerivative(image, bytes, "@2x", new ImageDimensions(width, height), dottedExtension));
        }

        for (Integer size : options.getSizes()) {
            if (size == null || size <= 0 || size >= width) {
                continue;
            }
            int customHeight = Math.max(1, (int) Math.round(size * (double) height / width));
            byte[] bytes = resize(source, size, customHeight, format, options.getQuality());
            derivatives.add(createDerivative(image, bytes, "@" + size + "w", new ImageDimensions(size, customHeight), dottedExtension));
        }

        return derivatives;
    }

    /**
     * WebP failures propagate; AVIF failures are logged and skipped since few runtimes ship an encoder.
     */
    @Override
    public List<AssetDerivative> convertToModernFormats(ProcessedAsset image, ModernFormatOptions options) throws IOException {
        requireImage(image);
        List<AssetDerivative> derivatives = new ArrayList<>();

        // Vector images don't need format conversion
        if (SVG_EXTENSION.equals(FileUtils.getExtension(image.getRelativePath()))) {
            return derivatives;
        }
        if (!options.isWebpEnabled() && !options.isAvifEnabled()) {
            return derivatives;
        }

        BufferedImage source = ImageIO.read(image.getSourcePath().toFile());
        if (source == null) {
            throw new IOException("Unable to decode image " + image.getRelativePath());
        }
        ImageDimensions dimensions = new ImageDimensions(source.getWidth(), source.getHeight());

        if (options.isWebpEnabled()) {
            byte[] webp = encode(source, "webp", options.getWebpQuality());
            derivatives.add(createDerivative(image, webp, "webp", dimensions, ".webp"));
        }

        if (options.isAvifEnabled()) {
            try {
                byte[] avif = encode(source, "avif", options.getAvifQuality());
                derivatives.add(createDerivative(image, avif, "avif", dimensions, ".avif"));
            } catch (IOException e) {
                BuildLogger.logRecurringWarning("ImageOptimizer", "AVIF conversion skipped: " + e.getMessage(), null);
            }
        }

        return derivatives;
    }

    private AssetDerivative createDerivative(ProcessedAsset image, byte[] bytes, String variant,
                                             ImageDimensions dimensions, String extension) {
        String baseName = FileUtils.getBaseName(image.getRelativePath());
        String hashedFilename = baseName + "." + FileUtils.sha256Hex(bytes).substring(0, 8) + variant + extension;
        String publicPath = FileUtils.joinUrlPath(publicDir, image.getLocale(), image.getVersion(), "images", hashedFilename);
        return new AssetDerivative(variant, publicPath, hashedFilename, bytes.length, dimensions, bytes);
    }

    private static byte[] resize(BufferedImage source, int width, int height, String format, int quality) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        Thumbnails.Builder<BufferedImage> builder = Thumbnails.of(source)
                .forceSize(width, height)
                .outputFormat(format);
        // Only JPEG has a meaningful quality knob
        if ("jpg".equals(format)) {
            builder.outputQuality(quality / 100f);
        }
        builder.toOutputStream(baos);
        return baos.toByteArray();
    }

    private static byte[] encode(BufferedImage image, String format, int quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format);
        if (!writers.hasNext()) {
            throw new IOException("No ImageIO writer registered for " + format);
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(baos)) {
            writer.setOutput(out);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if (param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                String[] types = param.getCompressionTypes();
                if (types != null && types.length > 0) {
                    param.setCompressionType(types[0]);
                }
                param.setCompressionQuality(quality / 100f);
            }
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
        return baos.toByteArray();
    }

    private static ImageDimensions readDimensions(Metadata metadata) {
        ImageDimensions dims = readTags(metadata.getFirstDirectoryOfType(PngDirectory.class),
                PngDirectory.TAG_IMAGE_WIDTH, PngDirectory.TAG_IMAGE_HEIGHT);
        if (dims == null) {
            dims = readTags(metadata.getFirstDirectoryOfType(JpegDirectory.class),
                    JpegDirectory.TAG_IMAGE_WIDTH, JpegDirectory.TAG_IMAGE_HEIGHT);
        }
        if (dims == null) {
            dims = readTags(metadata.getFirstDirectoryOfType(GifHeaderDirectory.class),
                    GifHeaderDirectory.TAG_IMAGE_WIDTH, GifHeaderDirectory.TAG_IMAGE_HEIGHT);
        }
        if (dims == null) {
            dims = readTags(metadata.getFirstDirectoryOfType(WebpDirectory.class),
                    WebpDirectory.TAG_IMAGE_WIDTH, WebpDirectory.TAG_IMAGE_HEIGHT);
        }
        return dims;
    }

    private static ImageDimensions readTags(Directory directory, int widthTag, int heightTag) {
        if (directory == null || !directory.containsTag(widthTag) || !directory.containsTag(heightTag)) {
            return null;
        }
        try {
            int width = directory.getInt(widthTag);
            int height = directory.getInt(heightTag);
            return width > 0 && height > 0 ? new ImageDimensions(width, height) : null;
        } catch (MetadataException e) {
            return null;
        }
    }

    private static ImageDimensions readSvgDimensions(Path image) throws IOException {
        String head = new String(Files.readAllBytes(image), StandardCharsets.UTF_8);
        Matcher width = SVG_WIDTH.matcher(head);
        Matcher height = SVG_HEIGHT.matcher(head);
        if (width.find() && height.find()) {
            return new ImageDimensions(Integer.parseInt(width.group(1)), Integer.parseInt(height.group(1)));
        }
        Matcher viewBox = SVG_VIEWBOX.matcher(head);
        if (viewBox.find()) {
            return new ImageDimensions(
                    (int) Math.round(Double.parseDouble(viewBox.group(1))),
                    (int) Math.round(Double.parseDouble(viewBox.group(2))));
        }
        throw new IOException("SVG declares neither width/height nor viewBox: " + image);
    }

    private static void requireImage(ProcessedAsset image) {
        if (image.getType() != AssetType.IMAGE) {
            throw new IllegalArgumentException("Asset is not an image: " + image.getRelativePath());
        }
    }
}
