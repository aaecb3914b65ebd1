package app.listify.assets.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.assets.pipeline")
public record AssetPipelineProps(
        String modelsDir,
        String previewsDir,
        boolean mirrorPreviews
) {
    public AssetPipelineProps {
        if (modelsDir == null || modelsDir.isBlank()) {
            modelsDir = "data/models";
        }
        if (previewsDir == null || previewsDir.isBlank()) {
            previewsDir = "data/previews";
        }
    }
}
