package app.listify.assets.provider.replicate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Component
public class ReplicateClient {

    private static final String DEFAULT_BASE_URL = "https://api.replicate.com";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public ReplicateClient(RestClient.Builder restClientBuilder,
                           ReplicateProps props,
                           ObjectMapper objectMapper) {
        Duration connectTimeout = Duration.ofSeconds(positive(props.connectTimeoutSeconds(), 20));
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
        requestFactory.setReadTimeout(Duration.ofSeconds(positive(props.readTimeoutSeconds(), 120)));
        String baseUrl = props.baseUrl() == null || props.baseUrl().isBlank() ? DEFAULT_BASE_URL : props.baseUrl();
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
        this.objectMapper = objectMapper;
    }

    /**
     * Creates a prediction, asking the service to hold the response until it finishes when
     * it can. The returned prediction may still be running.
     */
    public ReplicatePrediction createPrediction(String apiToken, String version, JsonNode input) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("version", version);
        payload.set("input", input);

        JsonNode response = restClient.post()
                .uri("/v1/predictions")
                .header(HttpHeaders.AUTHORIZATION, bearer(apiToken))
                .header("Prefer", "wait")
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new IllegalStateException("Replicate prediction response is empty");
        }
        return parsePrediction(response);
    }

    public ReplicatePrediction getPrediction(String apiToken, String predictionId) {
        JsonNode response = restClient.get()
                .uri("/v1/predictions/{predictionId}", predictionId)
                .header(HttpHeaders.AUTHORIZATION, bearer(apiToken))
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new IllegalStateException("Replicate prediction status is empty");
        }
        return parsePrediction(response);
    }

    private ReplicatePrediction parsePrediction(JsonNode response) {
        String id = response.path("id").asText(null);
        String status = response.path("status").asText(null);
        JsonNode output = response.get("output");
        JsonNode errorNode = response.get("error");
        String error = errorNode == null || errorNode.isNull() ? null : errorNode.asText();
        return new ReplicatePrediction(id, status, output, error);
    }

    private String bearer(String token) {
        return "Bearer " + token;
    }

    private static long positive(Long value, long fallback) {
        return value == null || value <= 0 ? fallback : value;
    }
}
