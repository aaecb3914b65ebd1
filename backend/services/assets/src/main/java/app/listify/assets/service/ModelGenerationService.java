package app.listify.assets.service;

import app.listify.assets.domain.GeneratedModel;
import app.listify.assets.provider.replicate.ReplicateClient;
import app.listify.assets.provider.replicate.ReplicateOutputParser;
import app.listify.assets.provider.replicate.ReplicatePrediction;
import app.listify.assets.provider.replicate.ReplicateProps;
import app.listify.assets.support.DaemonExecutors;
import app.listify.assets.support.RetryingInvoker;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Turns a preprocessed product image into a generated 3D model through the remote
 * image-to-3D service. Calls run on a dedicated pool and are retried with backoff.
 */
@Service
public class ModelGenerationService {

    static final String PLACEHOLDER_TOKEN = "your_replicate_api_token_here";

    private static final Logger log = LoggerFactory.getLogger(ModelGenerationService.class);
    private static final String OPERATION = "Model generation";
    private static final String DEFAULT_MODEL_VERSION = "e8f6c45206993f297372f5436b90350817bd9b4a0d52d2a76df50c1c8afa2b3c";

    private final ReplicateClient client;
    private final ReplicateProps props;
    private final RetryingInvoker retryingInvoker;
    private final ObjectMapper objectMapper;
    private final Duration pollInterval;
    private final Duration maxWait;
    private final ExecutorService executor;

    public ModelGenerationService(ReplicateClient client,
                                  ReplicateProps props,
                                  RetryingInvoker retryingInvoker,
                                  ObjectMapper objectMapper,
                                  @Value("${app.assets.generation.threads:4}") int threads) {
        this.client = client;
        this.props = props;
        this.retryingInvoker = retryingInvoker;
        this.objectMapper = objectMapper;
        this.pollInterval = Duration.ofMillis(props.pollIntervalMs() == null ? 2000 : Math.max(props.pollIntervalMs(), 0));
        this.maxWait = Duration.ofSeconds(props.maxWaitSeconds() == null ? 600 : Math.max(props.maxWaitSeconds(), 1));
        this.executor = DaemonExecutors.fixed("model-generation", threads);
    }

    public boolean isConfigured() {
        String token = props.apiToken();
        return token != null && !token.isBlank() && !PLACEHOLDER_TOKEN.equals(token.trim());
    }

    public GeneratedModel generate(Path preprocessedImage) {
        if (!isConfigured()) {
            throw new IllegalStateException("Generation service credentials are not configured");
        }
        ObjectNode input = buildInput(encodeImage(preprocessedImage));
        Future<GeneratedModel> future = executor.submit(() -> retryingInvoker.invoke(OPERATION, () -> runPrediction(input)));
        try {
            GeneratedModel model = future.get();
            log.info("Model generation completed previews={}", model.previewUrls().size());
            return model;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IllegalStateException("Model generation interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Model generation failed", cause);
        }
    }

    private GeneratedModel runPrediction(ObjectNode input) throws InterruptedException {
        String token = props.apiToken().trim();
        ReplicatePrediction prediction = client.createPrediction(token, modelVersion(), input);
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (!prediction.terminal()) {
            if (prediction.id() == null || prediction.id().isBlank()) {
                throw new IllegalStateException("Generation response is missing a prediction id");
            }
            if (System.nanoTime() > deadline) {
                throw new IllegalStateException("Generation did not finish within " + maxWait.toSeconds() + "s");
            }
            if (!pollInterval.isZero()) {
                Thread.sleep(pollInterval.toMillis());
            }
            prediction = client.getPrediction(token, prediction.id());
            log.debug("Model generation polled predictionId={} status={}", prediction.id(), prediction.status());
        }
        if (!prediction.succeeded()) {
            throw new IllegalStateException("Generation " + prediction.status() + ": "
                    + (prediction.error() == null ? "no error detail" : prediction.error()));
        }
        return ReplicateOutputParser.parse(prediction.output());
    }

    ObjectNode buildInput(String imageBase64) {
        ObjectNode input = objectMapper.createObjectNode();
        input.put("image", "data:image/png;base64," + imageBase64);
        input.put("seed", props.seed() == null ? 0 : props.seed());
        input.put("texture_size", props.textureSize() == null ? 1024 : props.textureSize());
        input.put("mesh_simplify", props.meshSimplify() == null ? 0.95 : props.meshSimplify());
        input.put("generate_model", true);
        input.put("generate_color", true);
        input.put("generate_normal", true);
        input.put("ss_sampling_steps", props.ssSamplingSteps() == null ? 12 : props.ssSamplingSteps());
        input.put("slat_sampling_steps", props.slatSamplingSteps() == null ? 12 : props.slatSamplingSteps());
        input.put("ss_guidance_strength", props.ssGuidanceStrength() == null ? 7.5 : props.ssGuidanceStrength());
        input.put("slat_guidance_strength", props.slatGuidanceStrength() == null ? 3.0 : props.slatGuidanceStrength());
        return input;
    }

    private String encodeImage(Path image) {
        try {
            return Base64.getEncoder().encodeToString(Files.readAllBytes(image));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read preprocessed image", ex);
        }
    }

    private String modelVersion() {
        String version = props.modelVersion();
        return version == null || version.isBlank() ? DEFAULT_MODEL_VERSION : version.trim();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
