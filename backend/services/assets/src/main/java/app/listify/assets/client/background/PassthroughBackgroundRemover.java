package app.listify.assets.client.background;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Used when no background-removal service is configured; the image is kept as uploaded.
 * Every call logs a warning so a missing remote remover shows up in production logs.
 */
@Component
@ConditionalOnProperty(name = "app.assets.background-removal.provider", havingValue = "passthrough", matchIfMissing = true)
public class PassthroughBackgroundRemover implements BackgroundRemover {

    private static final Logger log = LoggerFactory.getLogger(PassthroughBackgroundRemover.class);

    @Override
    public byte[] removeBackground(byte[] imageBytes) {
        log.warn("Background removal not configured, image kept as uploaded sizeBytes={}", imageBytes.length);
        return imageBytes;
    }
}
