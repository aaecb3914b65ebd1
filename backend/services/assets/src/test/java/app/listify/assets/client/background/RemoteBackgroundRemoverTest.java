package app.listify.assets.client.background;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RemoteBackgroundRemoverTest {

    private HttpServer server;
    private final AtomicReference<String> apiKey = new AtomicReference<>();
    private final AtomicReference<String> contentType = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/remove", exchange -> {
            byte[] body = exchange.getRequestBody().readAllBytes();
            apiKey.set(exchange.getRequestHeaders().getFirst("X-Api-Key"));
            contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            byte[] reversed = new byte[body.length];
            for (int i = 0; i < body.length; i++) {
                reversed[i] = body[body.length - 1 - i];
            }
            exchange.sendResponseHeaders(200, reversed.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reversed);
            }
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void postsImageBytesAndReturnsResponse() {
        RemoteBackgroundRemover remover = new RemoteBackgroundRemover(RestClient.builder(),
                new BackgroundRemovalProps("remote", baseUrl(), "key-1", 10L));

        byte[] result = remover.removeBackground(new byte[]{1, 2, 3});

        assertArrayEquals(new byte[]{3, 2, 1}, result);
        assertEquals("key-1", apiKey.get());
        assertEquals("application/octet-stream", contentType.get());
    }

    @Test
    void requiresBaseUrl() {
        assertThrows(IllegalStateException.class, () -> new RemoteBackgroundRemover(RestClient.builder(),
                new BackgroundRemovalProps("remote", null, null, null)));
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }
}
