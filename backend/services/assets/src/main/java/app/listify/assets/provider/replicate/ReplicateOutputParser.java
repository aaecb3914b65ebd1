package app.listify.assets.provider.replicate;

import app.listify.assets.domain.GeneratedModel;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

public final class ReplicateOutputParser {

    private static final String MODEL_KEY = "model";
    private static final String RENDER_PREFIX = "render_";

    private ReplicateOutputParser() {
    }

    /**
     * A text output is the model URL itself; an object output carries it under {@code model}
     * with preview renders under {@code render_*} keys.
     *
     * @throws IllegalStateException if no model URL is present
     */
    public static GeneratedModel parse(JsonNode output) {
        String modelUrl = null;
        List<String> previews = new ArrayList<>();
        if (output != null && output.isTextual()) {
            modelUrl = output.asText();
        } else if (output != null && output.isObject()) {
            modelUrl = text(output.get(MODEL_KEY));
            Iterator<Map.Entry<String, JsonNode>> fields = output.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getKey().startsWith(RENDER_PREFIX)) {
                    continue;
                }
                String url = text(field.getValue());
                if (url != null) {
                    previews.add(url);
                }
            }
        }
        if (modelUrl == null || modelUrl.isBlank()) {
            throw new IllegalStateException("Generation did not return a valid model URL");
        }
        return new GeneratedModel(modelUrl.trim(), previews);
    }

    private static String text(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
