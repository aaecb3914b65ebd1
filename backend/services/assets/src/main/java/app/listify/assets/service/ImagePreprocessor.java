package app.listify.assets.service;

import app.listify.assets.client.background.BackgroundRemover;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Cuts the product out of its photo and places it on an opaque white background, which is
 * what the image-to-3D model expects.
 */
@Service
public class ImagePreprocessor {

    static final String SUFFIX = "_processed.png";

    private static final Logger log = LoggerFactory.getLogger(ImagePreprocessor.class);

    private final BackgroundRemover backgroundRemover;

    public ImagePreprocessor(BackgroundRemover backgroundRemover) {
        this.backgroundRemover = backgroundRemover;
    }

    public Path preprocess(Path imagePath) {
        try {
            byte[] original = Files.readAllBytes(imagePath);
            byte[] cutout = backgroundRemover.removeBackground(original);
            BufferedImage foreground = ImageIO.read(new ByteArrayInputStream(cutout));
            if (foreground == null) {
                throw new IllegalStateException("Unsupported image format: " + imagePath.getFileName());
            }
            BufferedImage composite = new BufferedImage(foreground.getWidth(), foreground.getHeight(), BufferedImage.TYPE_INT_RGB);
            Graphics2D graphics = composite.createGraphics();
            try {
                graphics.setColor(Color.WHITE);
                graphics.fillRect(0, 0, composite.getWidth(), composite.getHeight());
                graphics.drawImage(foreground, 0, 0, null);
            } finally {
                graphics.dispose();
            }
            Path output = preprocessedPath(imagePath);
            if (!ImageIO.write(composite, "png", output.toFile())) {
                throw new IllegalStateException("No PNG writer available");
            }
            log.info("Background removed input={} output={}", imagePath.getFileName(), output);
            return output;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to preprocess image: " + ex.getMessage(), ex);
        }
    }

    static Path preprocessedPath(Path imagePath) {
        String fileName = imagePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return imagePath.resolveSibling(stem + SUFFIX);
    }
}
