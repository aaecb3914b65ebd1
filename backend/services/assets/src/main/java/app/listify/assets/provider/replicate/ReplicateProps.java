package app.listify.assets.provider.replicate;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.assets.replicate")
public record ReplicateProps(
        String baseUrl,
        String apiToken,
        String modelVersion,
        Integer seed,
        Integer textureSize,
        Double meshSimplify,
        Integer ssSamplingSteps,
        Integer slatSamplingSteps,
        Double ssGuidanceStrength,
        Double slatGuidanceStrength,
        Long pollIntervalMs,
        Long maxWaitSeconds,
        Long connectTimeoutSeconds,
        Long readTimeoutSeconds
) {
}
