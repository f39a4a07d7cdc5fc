package com.docassets;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Fixture helpers: real image files and content-tree layout.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * Writes a real PNG of the given size; {@code seed} changes the pixels and therefore the hash.
     */
    public static Path writePng(Path file, int width, int height, int seed) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(new Color((seed * 40) % 256, (seed * 90) % 256, (seed * 150) % 256));
        g.fillRect(0, 0, width, height);
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, Math.max(1, width / 3), Math.max(1, height / 3));
        g.dispose();
        Files.createDirectories(file.toAbsolutePath().getParent());
        ImageIO.write(image, "png", file.toFile());
        return file;
    }

    /**
     * Resolves {@code {root}/{locale}/{version}/assets/{relative}} and creates its parent directories.
     */
    public static Path assetPath(Path root, String locale, String version, String relative) throws IOException {
        Path file = root.resolve(locale).resolve(version).resolve("assets").resolve(relative);
        Files.createDirectories(file.getParent());
        return file;
    }
}
