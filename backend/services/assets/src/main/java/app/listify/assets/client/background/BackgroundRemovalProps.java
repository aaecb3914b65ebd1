package app.listify.assets.client.background;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.assets.background-removal")
public record BackgroundRemovalProps(
        String provider,
        String baseUrl,
        String apiKey,
        Long timeoutSeconds
) {
}
