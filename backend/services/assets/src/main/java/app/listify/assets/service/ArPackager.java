package app.listify.assets.service;

import app.listify.assets.service.ar.ArConversionStrategy;
import app.listify.assets.support.DaemonExecutors;
import app.listify.assets.support.ErrorMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Packages a generated model for AR viewers. Conversion strategies are tried in order and
 * the first one that produces a file wins; when none can, the model simply has no AR form.
 */
@Service
public class ArPackager {

    private static final Logger log = LoggerFactory.getLogger(ArPackager.class);

    private final List<ArConversionStrategy> strategies;
    private final ExecutorService executor;

    public ArPackager(List<ArConversionStrategy> strategies,
                      @Value("${app.assets.ar.threads:1}") int threads) {
        this.strategies = List.copyOf(strategies);
        this.executor = DaemonExecutors.fixed("ar-packager", threads);
    }

    public CompletableFuture<Optional<Path>> submit(Path modelPath, Path outputPath) {
        return CompletableFuture.supplyAsync(() -> packageModel(modelPath, outputPath), executor);
    }

    public Optional<Path> packageModel(Path modelPath, Path outputPath) {
        if (modelPath == null || !Files.isRegularFile(modelPath)) {
            log.warn("AR packaging skipped, model missing path={}", modelPath);
            return Optional.empty();
        }
        for (ArConversionStrategy strategy : strategies) {
            try {
                Optional<Path> converted = strategy.convert(modelPath, outputPath);
                if (converted.isPresent()) {
                    log.info("AR package created strategy={} path={}", strategy.name(), converted.get());
                    return converted;
                }
            } catch (RuntimeException ex) {
                log.warn("AR strategy failed strategy={} error={}", strategy.name(), ErrorMessages.summarize(ex));
            }
        }
        log.warn("No AR conversion available model={}", modelPath.getFileName());
        return Optional.empty();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
