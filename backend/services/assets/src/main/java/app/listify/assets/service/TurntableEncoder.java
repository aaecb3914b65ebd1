package app.listify.assets.service;

import app.listify.assets.error.EncodingException;
import app.listify.assets.error.PartialRenderException;
import app.listify.assets.support.DaemonExecutors;
import app.listify.assets.support.ErrorMessages;
import app.listify.assets.support.ScratchDirectory;
import app.listify.assets.support.mesh.FrameRenderer;
import app.listify.assets.support.mesh.GlbModelReader;
import app.listify.assets.support.mesh.MeshModel;
import app.listify.assets.support.mesh.Rotation;
import app.listify.assets.support.video.VideoEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Renders a 360 degree turntable of a GLB model and encodes it as a video.
 * Rendering runs on its own pool so it never occupies the threads serving network calls.
 */
@Service
public class TurntableEncoder {

    private static final Logger log = LoggerFactory.getLogger(TurntableEncoder.class);
    private static final String FRAME_PATTERN = "frame_%04d.png";
    private static final double MIN_RENDERED_RATIO = 0.5;

    private final FrameRenderer frameRenderer;
    private final VideoEncoder videoEncoder;
    private final TurntableOptions defaults;
    private final ExecutorService executor;

    public TurntableEncoder(FrameRenderer frameRenderer,
                            VideoEncoder videoEncoder,
                            @Value("${app.assets.turntable.frames:60}") int frameCount,
                            @Value("${app.assets.turntable.fps:10}") int fps,
                            @Value("${app.assets.turntable.width:800}") int width,
                            @Value("${app.assets.turntable.height:600}") int height,
                            @Value("${app.assets.turntable.render-threads:2}") int renderThreads) {
        this.frameRenderer = frameRenderer;
        this.videoEncoder = videoEncoder;
        this.defaults = new TurntableOptions(frameCount, fps, width, height);
        this.executor = DaemonExecutors.fixed("turntable-render", renderThreads);
    }

    public CompletableFuture<Path> submit(Path modelPath, Path outputPath) {
        return CompletableFuture.supplyAsync(() -> encode(modelPath, outputPath, defaults), executor);
    }

    public Path encode(Path modelPath, Path outputPath) {
        return encode(modelPath, outputPath, defaults);
    }

    public Path encode(Path modelPath, Path outputPath, TurntableOptions options) {
        if (modelPath == null || !Files.isRegularFile(modelPath)) {
            throw new EncodingException("Model file not found: " + modelPath);
        }
        log.info("Turntable encoding started model={} frames={} fps={} size={}x{}",
                modelPath, options.frameCount(), options.fps(), options.width(), options.height());
        MeshModel model;
        try {
            model = GlbModelReader.read(modelPath);
        } catch (IOException ex) {
            throw new EncodingException("Failed to load model: " + ex.getMessage(), ex);
        }

        try (ScratchDirectory frames = ScratchDirectory.create("listify-turntable-")) {
            int rendered = renderFrames(model, frames, options);
            int required = (int) Math.ceil(options.frameCount() * MIN_RENDERED_RATIO);
            if (rendered < required) {
                throw new PartialRenderException(rendered, options.frameCount());
            }
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            videoEncoder.encode(frames.path(), FRAME_PATTERN, options.fps(), outputPath);
            if (!Files.isRegularFile(outputPath) || Files.size(outputPath) == 0) {
                throw new EncodingException("Encoded video was not created or is empty");
            }
            log.info("Turntable encoding completed output={} sizeMb={} rendered={}/{}",
                    outputPath, megabytes(Files.size(outputPath)), rendered, options.frameCount());
            return outputPath;
        } catch (IOException ex) {
            throw new EncodingException("Turntable encoding failed: " + ex.getMessage(), ex);
        }
    }

    private int renderFrames(MeshModel model, ScratchDirectory frames, TurntableOptions options) throws IOException {
        int rendered = 0;
        for (int i = 0; i < options.frameCount(); i++) {
            double angle = 2 * Math.PI * i / options.frameCount();
            BufferedImage image;
            try {
                image = frameRenderer.render(model, Rotation.aboutVerticalAxis(angle), options.width(), options.height());
                rendered++;
            } catch (RuntimeException ex) {
                log.warn("Turntable frame {} render failed, using placeholder: {}", i, ErrorMessages.summarize(ex));
                image = placeholder(options.width(), options.height());
            }
            Path framePath = frames.resolve(String.format(Locale.ROOT, FRAME_PATTERN, i));
            if (!ImageIO.write(image, "png", framePath.toFile())) {
                throw new IOException("No PNG writer available");
            }
        }
        return rendered;
    }

    private static BufferedImage placeholder(int width, int height) {
        BufferedImage blank = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = blank.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, width, height);
        } finally {
            graphics.dispose();
        }
        return blank;
    }

    private static String megabytes(long bytes) {
        return String.format(Locale.ROOT, "%.2f", bytes / (1024.0 * 1024.0));
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public record TurntableOptions(int frameCount, int fps, int width, int height) {
        public TurntableOptions {
            frameCount = Math.max(frameCount, 1);
            fps = Math.max(fps, 1);
            width = Math.max(width, 16);
            height = Math.max(height, 16);
        }
    }
}
