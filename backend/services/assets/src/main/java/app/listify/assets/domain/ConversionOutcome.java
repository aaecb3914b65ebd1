package app.listify.assets.domain;

import java.nio.file.Path;

/**
 * Result of one format conversion: a produced file or the reason there is none.
 */
public record ConversionOutcome(Path path, String failureReason) {

    public static ConversionOutcome produced(Path path) {
        return new ConversionOutcome(path, null);
    }

    public static ConversionOutcome failed(String reason) {
        return new ConversionOutcome(null, reason == null || reason.isBlank() ? "unknown failure" : reason);
    }

    public boolean succeeded() {
        return path != null;
    }
}
