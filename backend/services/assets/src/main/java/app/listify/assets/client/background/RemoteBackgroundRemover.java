package app.listify.assets.client.background;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Component
@ConditionalOnProperty(name = "app.assets.background-removal.provider", havingValue = "remote")
public class RemoteBackgroundRemover implements BackgroundRemover {

    private final RestClient restClient;
    private final BackgroundRemovalProps props;

    public RemoteBackgroundRemover(RestClient.Builder restClientBuilder, BackgroundRemovalProps props) {
        if (props.baseUrl() == null || props.baseUrl().isBlank()) {
            throw new IllegalStateException("app.assets.background-removal.base-url is required for the remote provider");
        }
        Duration timeout = Duration.ofSeconds(props.timeoutSeconds() == null ? 60 : Math.max(props.timeoutSeconds(), 1));
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build());
        requestFactory.setReadTimeout(timeout);
        this.restClient = restClientBuilder
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory)
                .build();
        this.props = props;
    }

    @Override
    public byte[] removeBackground(byte[] imageBytes) {
        RestClient.RequestBodySpec request = restClient.post()
                .uri("/remove")
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .accept(MediaType.IMAGE_PNG);
        if (props.apiKey() != null && !props.apiKey().isBlank()) {
            request.header("X-Api-Key", props.apiKey());
        }
        byte[] response = request.body(imageBytes)
                .retrieve()
                .body(byte[].class);

        if (response == null || response.length == 0) {
            throw new IllegalStateException("Background removal response is empty");
        }
        return response;
    }
}
