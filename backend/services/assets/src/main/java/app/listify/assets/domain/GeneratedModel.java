package app.listify.assets.domain;

import java.util.List;

public record GeneratedModel(String modelUrl, List<String> previewUrls) {
    public GeneratedModel {
        previewUrls = previewUrls == null ? List.of() : List.copyOf(previewUrls);
    }
}
