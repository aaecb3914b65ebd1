package app.listify.assets.service.ar;

import java.nio.file.Path;
import java.util.Optional;

/**
 * One way of turning a GLB model into a USDZ package. Implementations report inability
 * with an empty result rather than an exception.
 */
public interface ArConversionStrategy {

    Optional<Path> convert(Path modelPath, Path outputPath);

    default String name() {
        return getClass().getSimpleName();
    }
}
