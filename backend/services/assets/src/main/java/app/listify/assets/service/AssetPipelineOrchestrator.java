package app.listify.assets.service;

import app.listify.assets.config.AssetPipelineProps;
import app.listify.assets.domain.AssetBundle;
import app.listify.assets.domain.ConversionOutcome;
import app.listify.assets.domain.GeneratedModel;
import app.listify.assets.support.ErrorMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Runs one product photo through the whole pipeline: background removal, model generation,
 * model download, then the turntable video and AR package in parallel.
 * <p>
 * {@link #run(Path)} never throws. Failures end up in an {@code error} bundle that keeps
 * whatever was produced before the failure.
 */
@Service
public class AssetPipelineOrchestrator {

    static final String SKIPPED_MESSAGE = "Generation service credentials not configured. 3D generation skipped.";

    private static final Logger log = LoggerFactory.getLogger(AssetPipelineOrchestrator.class);

    private final ImagePreprocessor imagePreprocessor;
    private final ModelGenerationService modelGenerationService;
    private final StreamingTransfer streamingTransfer;
    private final TurntableEncoder turntableEncoder;
    private final ArPackager arPackager;
    private final AssetPipelineProps props;

    public AssetPipelineOrchestrator(ImagePreprocessor imagePreprocessor,
                                     ModelGenerationService modelGenerationService,
                                     StreamingTransfer streamingTransfer,
                                     TurntableEncoder turntableEncoder,
                                     ArPackager arPackager,
                                     AssetPipelineProps props) {
        this.imagePreprocessor = imagePreprocessor;
        this.modelGenerationService = modelGenerationService;
        this.streamingTransfer = streamingTransfer;
        this.turntableEncoder = turntableEncoder;
        this.arPackager = arPackager;
        this.props = props;
    }

    public AssetBundle run(Path imagePath) {
        AssetBundleAccumulator result = new AssetBundleAccumulator(System.nanoTime());
        try {
            log.info("Asset pipeline started image={}", imagePath.getFileName());
            Path preprocessed = imagePreprocessor.preprocess(imagePath);
            result.preprocessedImage(preprocessed);

            if (!modelGenerationService.isConfigured()) {
                log.warn("Model generation skipped, credentials not configured");
                return result.skipped(SKIPPED_MESSAGE);
            }

            GeneratedModel generated = modelGenerationService.generate(preprocessed);
            result.previewRenders(generated.previewUrls());

            String modelId = newModelId();
            Path modelsDir = Path.of(props.modelsDir());
            Files.createDirectories(modelsDir);
            Path modelPath = modelsDir.resolve(modelId + ".glb");
            streamingTransfer.fetch(generated.modelUrl(), modelPath);
            result.model(modelPath);

            if (props.mirrorPreviews() && !generated.previewUrls().isEmpty()) {
                result.previewPaths(mirrorPreviews(generated.previewUrls(), modelId));
            }

            CompletableFuture<ConversionOutcome> video = turntableEncoder
                    .submit(modelPath, modelsDir.resolve(modelId + ".mp4"))
                    .handle((path, ex) -> ex == null
                            ? ConversionOutcome.produced(path)
                            : ConversionOutcome.failed(ErrorMessages.summarize(unwrap(ex))));
            CompletableFuture<ConversionOutcome> ar = arPackager
                    .submit(modelPath, modelsDir.resolve(modelId + ".usdz"))
                    .handle(AssetPipelineOrchestrator::arOutcome);
            CompletableFuture.allOf(video, ar).join();

            ConversionOutcome videoOutcome = video.join();
            ConversionOutcome arOutcome = ar.join();
            if (!videoOutcome.succeeded()) {
                log.warn("Turntable video failed modelId={} reason={}", modelId, videoOutcome.failureReason());
            }
            result.video(videoOutcome).ar(arOutcome);

            AssetBundle bundle = result.completed();
            log.info("Asset pipeline completed modelId={} formats={} seconds={}",
                    modelId, bundle.formatsGenerated(), bundle.processingTimeSeconds());
            return bundle;
        } catch (IOException | RuntimeException ex) {
            log.error("Asset pipeline failed image={} error={}", imagePath.getFileName(), ErrorMessages.summarize(ex), ex);
            return result.error(ex);
        }
    }

    private List<Path> mirrorPreviews(List<String> urls, String modelId) {
        try {
            Path directory = Path.of(props.previewsDir()).resolve(modelId);
            Files.createDirectories(directory);
            return streamingTransfer.fetchAll(urls, directory, "render");
        } catch (IOException | RuntimeException ex) {
            log.warn("Preview mirroring failed modelId={} error={}", modelId, ErrorMessages.summarize(ex));
            return List.of();
        }
    }

    private static ConversionOutcome arOutcome(Optional<Path> path, Throwable ex) {
        if (ex != null) {
            return ConversionOutcome.failed(ErrorMessages.summarize(unwrap(ex)));
        }
        return path.map(ConversionOutcome::produced)
                .orElseGet(() -> ConversionOutcome.failed("no conversion method available"));
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }

    private static String newModelId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8).toLowerCase(Locale.ROOT);
    }
}
