package app.listify.assets.service.ar;

import app.listify.assets.support.ErrorMessages;
import app.listify.assets.support.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Converts with Apple's {@code usdzconvert} when it is installed on this host.
 */
@Component
@Order(1)
public class LocalUsdzConverterStrategy implements ArConversionStrategy {

    private static final Logger log = LoggerFactory.getLogger(LocalUsdzConverterStrategy.class);

    private final String converterPath;
    private final Duration timeout;

    public LocalUsdzConverterStrategy(@Value("${app.assets.ar.usdzconvert-path:usdzconvert}") String converterPath,
                                      @Value("${app.assets.ar.timeout-seconds:120}") long timeoutSeconds) {
        this.converterPath = converterPath == null || converterPath.isBlank() ? "usdzconvert" : converterPath.trim();
        this.timeout = Duration.ofSeconds(Math.max(timeoutSeconds, 5));
    }

    @Override
    public Optional<Path> convert(Path modelPath, Path outputPath) {
        if (!ProcessRunner.isAvailable(converterPath)) {
            log.debug("usdzconvert not found path={}", converterPath);
            return Optional.empty();
        }
        log.info("Converting to USDZ with usdzconvert model={}", modelPath);
        try {
            ProcessRunner.ProcessResult result = ProcessRunner.run(
                    List.of(converterPath, modelPath.toString(), outputPath.toString()),
                    timeout
            );
            if (!result.succeeded()) {
                log.warn("usdzconvert failed code={} output={}", result.exitCode(), result.summary());
                return Optional.empty();
            }
            if (!Files.isRegularFile(outputPath) || Files.size(outputPath) == 0) {
                log.warn("usdzconvert produced no output path={}", outputPath);
                return Optional.empty();
            }
            log.info("USDZ conversion completed sizeBytes={}", Files.size(outputPath));
            return Optional.of(outputPath);
        } catch (IOException | IllegalStateException ex) {
            log.warn("usdzconvert could not run error={}", ErrorMessages.summarize(ex));
            return Optional.empty();
        }
    }
}
