package app.listify.assets.service;

import app.listify.assets.error.TransferException;
import app.listify.assets.support.DaemonExecutors;
import app.listify.assets.support.ErrorMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Downloads remote files to disk one bounded chunk at a time, so memory use does not grow
 * with the size of the file.
 */
@Service
public class StreamingTransfer {

    public static final int DEFAULT_CHUNK_SIZE = 4 * 1024 * 1024;

    private static final Logger log = LoggerFactory.getLogger(StreamingTransfer.class);

    private final HttpClient httpClient;
    private final int chunkSize;
    private final Duration timeout;
    private final boolean keepPartialFiles;
    private final ExecutorService executor;
    private final ScheduledExecutorService watchdog;

    public StreamingTransfer(@Value("${app.assets.transfer.chunk-size-bytes:4194304}") int chunkSize,
                             @Value("${app.assets.transfer.timeout-seconds:300}") long timeoutSeconds,
                             @Value("${app.assets.transfer.connect-timeout-seconds:20}") long connectTimeoutSeconds,
                             @Value("${app.assets.transfer.keep-partial-files:false}") boolean keepPartialFiles,
                             @Value("${app.assets.transfer.parallelism:4}") int parallelism) {
        this.chunkSize = chunkSize > 0 ? chunkSize : DEFAULT_CHUNK_SIZE;
        this.timeout = Duration.ofSeconds(Math.max(timeoutSeconds, 1));
        this.keepPartialFiles = keepPartialFiles;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(Math.max(connectTimeoutSeconds, 1)))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.executor = DaemonExecutors.fixed("asset-transfer", parallelism);
        this.watchdog = DaemonExecutors.scheduled("asset-transfer-watchdog");
    }

    public TransferResult fetch(String url, Path destination) {
        return fetch(url, destination, chunkSize, timeout);
    }

    public TransferResult fetch(String url, Path destination, int chunkSize, Duration timeout) {
        if (url == null || url.isBlank()) {
            throw new TransferException("Download URL is missing");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        log.info("Download started url={}", url);
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean completed = false;
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .GET()
                    .build();
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream body = response.body()) {
                if (response.statusCode() < 200 || response.statusCode() >= 300) {
                    throw new TransferException("Download failed with status " + response.statusCode() + ": " + url);
                }
                Optional<String> declared = response.headers().firstValue("Content-Length");
                declared.ifPresent(length -> log.info("Download size sizeMb={}", megabytes(parseLong(length))));

                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw timedOut(url, timeout, null);
                }
                // a stalled body blocks readNBytes, so the deadline closes the stream from outside
                AtomicBoolean expired = new AtomicBoolean();
                ScheduledFuture<?> guard = watchdog.schedule(() -> {
                    expired.set(true);
                    closeBody(body, url);
                }, remaining, TimeUnit.NANOSECONDS);

                long written = 0;
                int chunks = 0;
                byte[] buffer = new byte[chunkSize];
                try (OutputStream out = Files.newOutputStream(destination)) {
                    int read;
                    while ((read = body.readNBytes(buffer, 0, chunkSize)) > 0) {
                        out.write(buffer, 0, read);
                        written += read;
                        chunks++;
                        if (expired.get() || System.nanoTime() > deadline) {
                            throw timedOut(url, timeout, null);
                        }
                    }
                } catch (IOException ex) {
                    if (expired.get()) {
                        throw timedOut(url, timeout, ex);
                    }
                    throw ex;
                } finally {
                    guard.cancel(false);
                }
                if (expired.get()) {
                    throw timedOut(url, timeout, null);
                }
                completed = true;
                log.info("Download completed sizeMb={} chunks={} path={}", megabytes(written), chunks, destination);
                return new TransferResult(destination, written, chunks);
            }
        } catch (TransferException ex) {
            log.error("Download failed url={} error={}", url, ex.getMessage());
            throw ex;
        } catch (HttpTimeoutException ex) {
            log.error("Download timed out url={}", url);
            throw timedOut(url, timeout, ex);
        } catch (IOException | IllegalArgumentException ex) {
            log.error("Download failed url={} error={}", url, ErrorMessages.summarize(ex));
            throw new TransferException("Download failed: " + ErrorMessages.summarize(ex), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransferException("Download interrupted: " + url, ex);
        } finally {
            if (!completed && !keepPartialFiles) {
                deletePartial(destination);
            }
        }
    }

    /**
     * Downloads several files concurrently. Failed downloads are logged and left out;
     * successful paths keep the order of {@code urls}.
     */
    public List<Path> fetchAll(List<String> urls, Path directory, String filenamePrefix) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<Path>> downloads = new ArrayList<>();
        for (int i = 0; i < urls.size(); i++) {
            String url = urls.get(i);
            Path destination = directory.resolve(filenamePrefix + "_" + i + extensionOf(url));
            downloads.add(CompletableFuture
                    .supplyAsync(() -> fetch(url, destination).destination(), executor)
                    .exceptionally(ex -> {
                        log.warn("Download skipped url={} error={}", url, ErrorMessages.summarize(ex.getCause() != null ? ex.getCause() : ex));
                        return null;
                    }));
        }
        CompletableFuture.allOf(downloads.toArray(new CompletableFuture[0])).join();
        List<Path> paths = new ArrayList<>();
        for (CompletableFuture<Path> download : downloads) {
            Path path = download.join();
            if (path != null) {
                paths.add(path);
            }
        }
        log.info("Downloaded {}/{} files into {}", paths.size(), urls.size(), directory);
        return paths;
    }

    static String extensionOf(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException ex) {
            return ".bin";
        }
        if (path == null) {
            return ".bin";
        }
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash || dot == path.length() - 1) {
            return ".bin";
        }
        return path.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static TransferException timedOut(String url, Duration timeout, Throwable cause) {
        return new TransferException("Download timed out after " + timeout.toSeconds() + "s: " + url, cause);
    }

    private static void closeBody(InputStream body, String url) {
        try {
            body.close();
        } catch (IOException ex) {
            log.debug("Closing stalled download failed url={} error={}", url, ex.getMessage());
        }
    }

    private void deletePartial(Path destination) {
        try {
            if (Files.deleteIfExists(destination)) {
                log.debug("Removed partial download path={}", destination);
            }
        } catch (IOException ex) {
            log.warn("Failed to remove partial download path={} error={}", destination, ex.getMessage());
        }
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    private static String megabytes(long bytes) {
        return String.format(Locale.ROOT, "%.2f", bytes / (1024.0 * 1024.0));
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        watchdog.shutdownNow();
    }

    /**
     * Outcome of one download. {@code chunkCount} is the number of buffer-sized reads written,
     * which shows the body was streamed in bounded pieces rather than held in memory.
     */
    public record TransferResult(Path destination, long bytesWritten, int chunkCount) {
    }
}
