package app.listify.assets.provider.replicate;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

public record ReplicatePrediction(
        String id,
        String status,
        JsonNode output,
        String error
) {
    public boolean succeeded() {
        return "succeeded".equals(normalizedStatus());
    }

    public boolean terminal() {
        String status = normalizedStatus();
        return "succeeded".equals(status) || "failed".equals(status) || "canceled".equals(status);
    }

    private String normalizedStatus() {
        return status == null ? "" : status.trim().toLowerCase(Locale.ROOT);
    }
}
