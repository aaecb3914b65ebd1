package app.listify.assets.service;

import app.listify.assets.config.AssetPipelineProps;
import app.listify.assets.domain.AssetBundle;
import app.listify.assets.domain.GeneratedModel;
import app.listify.assets.domain.type.AssetFormat;
import app.listify.assets.domain.type.AssetStatus;
import app.listify.assets.error.PartialRenderException;
import app.listify.assets.error.TransferException;
import app.listify.assets.service.ar.ArConversionStrategy;
import app.listify.assets.support.mesh.SoftwareFrameRenderer;
import app.listify.assets.support.mesh.TestGlbFiles;
import app.listify.assets.support.video.VideoEncoder;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AssetPipelineOrchestratorTest {

    private static final String MODEL_URL = "https://cdn.example.com/out.glb";
    private static final List<String> PREVIEWS = List.of(
            "https://cdn.example.com/render_front.png",
            "https://cdn.example.com/render_side.png"
    );

    @TempDir
    Path tempDir;

    private ImagePreprocessor imagePreprocessor;
    private ModelGenerationService modelGenerationService;
    private StreamingTransfer streamingTransfer;
    private TurntableEncoder turntableEncoder;
    private ArPackager arPackager;
    private Path image;
    private Path preprocessed;

    @BeforeEach
    void setUp() throws Exception {
        imagePreprocessor = mock(ImagePreprocessor.class);
        modelGenerationService = mock(ModelGenerationService.class);
        streamingTransfer = mock(StreamingTransfer.class);
        turntableEncoder = mock(TurntableEncoder.class);
        arPackager = mock(ArPackager.class);
        image = Files.write(tempDir.resolve("shoe.jpg"), new byte[]{1, 2, 3});
        preprocessed = tempDir.resolve("shoe_processed.png");
        when(imagePreprocessor.preprocess(image)).thenReturn(preprocessed);
        when(modelGenerationService.isConfigured()).thenReturn(true);
        when(modelGenerationService.generate(preprocessed)).thenReturn(new GeneratedModel(MODEL_URL, PREVIEWS));
        when(streamingTransfer.fetch(eq(MODEL_URL), any(Path.class))).thenAnswer(invocation -> {
            Path destination = invocation.getArgument(1);
            Files.write(destination, TestGlbFiles.cube(null, null));
            return new StreamingTransfer.TransferResult(destination, Files.size(destination), 1);
        });
        when(turntableEncoder.submit(any(Path.class), any(Path.class)))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(invocation.<Path>getArgument(1)));
        when(arPackager.submit(any(Path.class), any(Path.class)))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(Optional.of(invocation.<Path>getArgument(1))));
    }

    @Test
    void completedRunHasAllFormats() {
        AssetBundle bundle = orchestrator(false).run(image);

        assertThat(bundle.status()).isEqualTo(AssetStatus.completed);
        assertThat(bundle.formatsGenerated()).containsExactlyInAnyOrder(AssetFormat.model, AssetFormat.video, AssetFormat.ar);
        assertThat(bundle.previewRenderUrls()).containsExactlyElementsOf(PREVIEWS);
        assertThat(bundle.previewRenderPaths()).isEmpty();
        assertThat(bundle.preprocessedImagePath()).isEqualTo(preprocessed.toString());
        assertThat(bundle.modelPath()).matches(".*[0-9a-f]{8}\\.glb");
        String stem = bundle.modelPath().substring(0, bundle.modelPath().length() - ".glb".length());
        assertThat(bundle.videoPath()).isEqualTo(stem + ".mp4");
        assertThat(bundle.arModelPath()).isEqualTo(stem + ".usdz");
        assertThat(bundle.processingTimeSeconds()).isGreaterThanOrEqualTo(0);
        assertThat(bundle.message()).isNull();
        assertThat(bundle.status().refundEligible()).isFalse();
    }

    @Test
    void missingArConverterDegradesGracefully() {
        when(arPackager.submit(any(Path.class), any(Path.class)))
                .thenReturn(CompletableFuture.completedFuture(Optional.empty()));

        AssetBundle bundle = orchestrator(false).run(image);

        assertThat(bundle.status()).isEqualTo(AssetStatus.completed);
        assertThat(bundle.formatsGenerated()).containsExactlyInAnyOrder(AssetFormat.model, AssetFormat.video);
        assertThat(bundle.arModelPath()).isNull();
        assertThat(bundle.message()).contains("AR model unavailable");
    }

    @Test
    void videoFailureKeepsRunCompleted() {
        when(turntableEncoder.submit(any(Path.class), any(Path.class)))
                .thenReturn(CompletableFuture.failedFuture(new PartialRenderException(10, 60)));

        AssetBundle bundle = orchestrator(false).run(image);

        assertThat(bundle.status()).isEqualTo(AssetStatus.completed);
        assertThat(bundle.formatsGenerated()).containsExactlyInAnyOrder(AssetFormat.model, AssetFormat.ar);
        assertThat(bundle.videoPath()).isNull();
        assertThat(bundle.message()).contains("Too many frame rendering failures");
    }

    @Test
    void missingCredentialsSkipGeneration() {
        when(modelGenerationService.isConfigured()).thenReturn(false);

        AssetBundle bundle = orchestrator(false).run(image);

        assertThat(bundle.status()).isEqualTo(AssetStatus.skipped);
        assertThat(bundle.message()).isEqualTo("Generation service credentials not configured. 3D generation skipped.");
        assertThat(bundle.preprocessedImagePath()).isEqualTo(preprocessed.toString());
        assertThat(bundle.formatsGenerated()).isEmpty();
        assertThat(bundle.status().refundEligible()).isFalse();
        verify(modelGenerationService, never()).generate(any());
    }

    @Test
    void transferFailureReturnsErrorWithPartialFields() {
        when(streamingTransfer.fetch(eq(MODEL_URL), any(Path.class)))
                .thenThrow(new TransferException("Download failed with status 404: " + MODEL_URL));

        AssetBundle bundle = orchestrator(false).run(image);

        assertThat(bundle.status()).isEqualTo(AssetStatus.error);
        assertThat(bundle.errorDetail()).contains("404");
        assertThat(bundle.preprocessedImagePath()).isEqualTo(preprocessed.toString());
        assertThat(bundle.previewRenderUrls()).containsExactlyElementsOf(PREVIEWS);
        assertThat(bundle.modelPath()).isNull();
        assertThat(bundle.formatsGenerated()).isEmpty();
        assertThat(bundle.status().refundEligible()).isTrue();
        verify(turntableEncoder, never()).submit(any(), any());
    }

    @Test
    void generationFailureReturnsError() {
        when(modelGenerationService.generate(preprocessed))
                .thenThrow(new IllegalStateException("Generation failed: CUDA out of memory"));

        AssetBundle bundle = orchestrator(false).run(image);

        assertThat(bundle.status()).isEqualTo(AssetStatus.error);
        assertThat(bundle.message()).startsWith("3D asset generation failed");
        assertThat(bundle.errorDetail()).isEqualTo("Generation failed: CUDA out of memory");
    }

    @Test
    void preprocessingFailureReturnsErrorWithoutGeneration() {
        when(imagePreprocessor.preprocess(image))
                .thenThrow(new IllegalStateException("Unsupported image format: shoe.jpg"));

        AssetBundle bundle = orchestrator(false).run(image);

        assertThat(bundle.status()).isEqualTo(AssetStatus.error);
        assertThat(bundle.errorDetail()).isEqualTo("Unsupported image format: shoe.jpg");
        assertThat(bundle.preprocessedImagePath()).isNull();
        assertThat(bundle.modelPath()).isNull();
        assertThat(bundle.formatsGenerated()).isEmpty();
        verify(modelGenerationService, never()).generate(any());
        verify(streamingTransfer, never()).fetch(anyString(), any(Path.class));
    }

    @Test
    void failureAfterTransferKeepsModelPath() {
        when(turntableEncoder.submit(any(Path.class), any(Path.class)))
                .thenThrow(new IllegalStateException("render pool rejected task"));

        AssetBundle bundle = orchestrator(false).run(image);

        assertThat(bundle.status()).isEqualTo(AssetStatus.error);
        assertThat(bundle.errorDetail()).isEqualTo("render pool rejected task");
        assertThat(bundle.modelPath()).matches(".*[0-9a-f]{8}\\.glb");
        assertThat(Path.of(bundle.modelPath())).exists();
        assertThat(bundle.preprocessedImagePath()).isEqualTo(preprocessed.toString());
        assertThat(bundle.formatsGenerated()).isEmpty();
    }

    @Test
    void mirrorsPreviewsWhenEnabled() {
        when(streamingTransfer.fetchAll(eq(PREVIEWS), any(Path.class), anyString()))
                .thenAnswer(invocation -> {
                    Path directory = invocation.getArgument(1);
                    return List.of(directory.resolve("render_0.png"), directory.resolve("render_1.png"));
                });

        AssetBundle bundle = orchestrator(true).run(image);

        assertThat(bundle.previewRenderPaths()).hasSize(2);
        assertThat(bundle.previewRenderPaths().get(0)).startsWith(tempDir.resolve("previews").toString());
    }

    @Test
    void endToEndWithRealTransferAndRendering() throws Exception {
        byte[] glb = TestGlbFiles.cube(new float[]{0.2f, 0.4f, 0.8f}, null);
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/out.glb", exchange -> {
            exchange.sendResponseHeaders(200, glb.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(glb);
            }
        });
        server.start();
        String modelUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/out.glb";
        when(modelGenerationService.generate(preprocessed)).thenReturn(new GeneratedModel(modelUrl, List.of()));
        VideoEncoder videoEncoder = (frames, pattern, fps, output) -> {
            try {
                Files.write(output, new byte[]{0, 0, 0, 0x18});
            } catch (IOException ex) {
                throw new UncheckedIOException(ex);
            }
        };
        ArConversionStrategy noConverter = (model, output) -> Optional.empty();
        StreamingTransfer transfer = new StreamingTransfer(256, 30, 5, false, 1);
        TurntableEncoder encoder = new TurntableEncoder(new SoftwareFrameRenderer(), videoEncoder, 12, 10, 48, 36, 1);
        ArPackager packager = new ArPackager(List.of(noConverter), 1);
        try {
            AssetPipelineOrchestrator orchestrator = new AssetPipelineOrchestrator(
                    imagePreprocessor, modelGenerationService, transfer, encoder, packager, props(false));

            AssetBundle bundle = orchestrator.run(image);

            assertThat(bundle.status()).isEqualTo(AssetStatus.completed);
            assertThat(bundle.formatsGenerated()).isEqualTo(EnumSet.of(AssetFormat.model, AssetFormat.video));
            assertThat(Files.readAllBytes(Path.of(bundle.modelPath()))).isEqualTo(glb);
            assertThat(Path.of(bundle.videoPath())).exists();
        } finally {
            transfer.shutdown();
            encoder.shutdown();
            packager.shutdown();
            server.stop(0);
        }
    }

    private AssetPipelineOrchestrator orchestrator(boolean mirrorPreviews) {
        return new AssetPipelineOrchestrator(imagePreprocessor, modelGenerationService, streamingTransfer,
                turntableEncoder, arPackager, props(mirrorPreviews));
    }

    private AssetPipelineProps props(boolean mirrorPreviews) {
        return new AssetPipelineProps(
                tempDir.resolve("models").toString(),
                tempDir.resolve("previews").toString(),
                mirrorPreviews
        );
    }
}
