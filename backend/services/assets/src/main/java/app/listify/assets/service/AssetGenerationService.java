package app.listify.assets.service;

import app.listify.assets.domain.AssetBundle;
import app.listify.assets.domain.type.AssetStatus;
import app.listify.assets.support.ContentFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Entry point for callers: answers from the content cache when the same image was processed
 * before, otherwise runs the pipeline and caches completed results.
 */
@Service
public class AssetGenerationService {

    private static final Logger log = LoggerFactory.getLogger(AssetGenerationService.class);

    private final ContentCache contentCache;
    private final AssetPipelineOrchestrator orchestrator;
    private final boolean singleFlight;
    private final ConcurrentMap<String, CompletableFuture<AssetBundle>> inFlight = new ConcurrentHashMap<>();

    public AssetGenerationService(ContentCache contentCache,
                                  AssetPipelineOrchestrator orchestrator,
                                  @Value("${app.assets.cache.single-flight:false}") boolean singleFlight) {
        this.contentCache = contentCache;
        this.orchestrator = orchestrator;
        this.singleFlight = singleFlight;
    }

    public AssetBundle generate(Path imagePath) {
        Optional<AssetBundle> cached = contentCache.lookup(imagePath);
        if (cached.isPresent()) {
            return cached.get();
        }
        if (!singleFlight) {
            return runAndStore(imagePath);
        }
        String key;
        try {
            key = ContentFingerprint.of(imagePath).hex();
        } catch (IOException ex) {
            log.warn("Fingerprint failed, running without single-flight path={} error={}", imagePath, ex.getMessage());
            return runAndStore(imagePath);
        }
        CompletableFuture<AssetBundle> mine = new CompletableFuture<>();
        CompletableFuture<AssetBundle> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.info("Joining in-flight run fingerprint={}", key.substring(0, 8));
            return existing.join();
        }
        try {
            AssetBundle bundle = runAndStore(imagePath);
            mine.complete(bundle);
            return bundle;
        } catch (RuntimeException ex) {
            mine.completeExceptionally(ex);
            throw ex;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public int clearCache() {
        return contentCache.clear();
    }

    private AssetBundle runAndStore(Path imagePath) {
        AssetBundle bundle = orchestrator.run(imagePath);
        if (bundle.status() == AssetStatus.completed) {
            contentCache.store(imagePath, bundle);
        }
        return bundle;
    }
}
