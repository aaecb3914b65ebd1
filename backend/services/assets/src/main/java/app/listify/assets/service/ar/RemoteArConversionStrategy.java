package app.listify.assets.service.ar;

import app.listify.assets.support.ErrorMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Uploads the model to a hosted conversion service. Declines when no service is configured.
 */
@Component
@Order(2)
public class RemoteArConversionStrategy implements ArConversionStrategy {

    private static final Logger log = LoggerFactory.getLogger(RemoteArConversionStrategy.class);

    private final RestClient restClient;
    private final String apiKey;

    public RemoteArConversionStrategy(RestClient.Builder restClientBuilder,
                                      @Value("${app.assets.ar.remote-base-url:}") String baseUrl,
                                      @Value("${app.assets.ar.remote-api-key:}") String apiKey,
                                      @Value("${app.assets.ar.timeout-seconds:120}") long timeoutSeconds) {
        if (baseUrl == null || baseUrl.isBlank()) {
            this.restClient = null;
        } else {
            Duration timeout = Duration.ofSeconds(Math.max(timeoutSeconds, 5));
            JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(HttpClient.newBuilder()
                    .connectTimeout(timeout)
                    .build());
            requestFactory.setReadTimeout(timeout);
            this.restClient = restClientBuilder
                    .baseUrl(baseUrl.trim())
                    .requestFactory(requestFactory)
                    .build();
        }
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    @Override
    public Optional<Path> convert(Path modelPath, Path outputPath) {
        if (restClient == null) {
            log.info("Remote USDZ conversion not configured");
            return Optional.empty();
        }
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", new FileSystemResource(modelPath))
                .contentType(MediaType.parseMediaType("model/gltf-binary"));
        builder.part("target", "usdz");
        try {
            RestClient.RequestBodySpec request = restClient.post()
                    .uri("/convert")
                    .contentType(MediaType.MULTIPART_FORM_DATA);
            if (!apiKey.isEmpty()) {
                request.header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
            }
            byte[] converted = request.body(builder.build())
                    .retrieve()
                    .body(byte[].class);
            if (converted == null || converted.length == 0) {
                log.warn("Remote USDZ conversion returned no content");
                return Optional.empty();
            }
            Files.write(outputPath, converted);
            log.info("Remote USDZ conversion completed sizeBytes={}", converted.length);
            return Optional.of(outputPath);
        } catch (RestClientException | IOException ex) {
            log.warn("Remote USDZ conversion failed error={}", ErrorMessages.summarize(ex));
            return Optional.empty();
        }
    }
}
