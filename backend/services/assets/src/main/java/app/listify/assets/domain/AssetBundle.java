package app.listify.assets.domain;

import app.listify.assets.domain.type.AssetFormat;
import app.listify.assets.domain.type.AssetStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Result of one pipeline run. Paths are stored as strings so cached entries stay readable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssetBundle(
        String modelPath,
        String videoPath,
        String arModelPath,
        List<String> previewRenderUrls,
        List<String> previewRenderPaths,
        String preprocessedImagePath,
        AssetStatus status,
        Set<AssetFormat> formatsGenerated,
        double processingTimeSeconds,
        String message,
        String errorDetail
) {
    public AssetBundle {
        previewRenderUrls = previewRenderUrls == null ? List.of() : List.copyOf(previewRenderUrls);
        previewRenderPaths = previewRenderPaths == null ? List.of() : List.copyOf(previewRenderPaths);
        formatsGenerated = formatsGenerated == null || formatsGenerated.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(AssetFormat.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(formatsGenerated));
    }

    public boolean hasFormat(AssetFormat format) {
        return formatsGenerated.contains(format);
    }
}
