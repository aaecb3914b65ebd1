package app.listify.assets.service;

import app.listify.assets.domain.AssetBundle;
import app.listify.assets.support.ContentFingerprint;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * File-backed cache of pipeline results keyed by the SHA-256 of the input image.
 * One pretty-printed JSON file per fingerprint; entries never expire.
 * <p>
 * Reads and writes are best-effort: any failure is logged and treated as a miss.
 * There is no locking, so two runs for the same bytes may both miss and both store.
 */
@Service
public class ContentCache {

    static final String FILE_PREFIX = "3d_assets_";
    static final String FILE_SUFFIX = ".json";

    private static final Logger log = LoggerFactory.getLogger(ContentCache.class);

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final Path cacheDir;

    public ContentCache(ObjectMapper objectMapper,
                        @Value("${app.assets.cache.dir:data/cache}") String cacheDir) {
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
        this.cacheDir = Path.of(cacheDir == null || cacheDir.isBlank() ? "data/cache" : cacheDir.trim());
    }

    public Optional<AssetBundle> lookup(Path imagePath) {
        try {
            ContentFingerprint fingerprint = ContentFingerprint.of(imagePath);
            Path entry = entryPath(fingerprint);
            if (!Files.isRegularFile(entry)) {
                log.debug("Cache miss fingerprint={}", fingerprint.shortForm());
                return Optional.empty();
            }
            AssetBundle bundle = objectMapper.readValue(entry.toFile(), AssetBundle.class);
            log.info("Cache hit fingerprint={}", fingerprint.shortForm());
            return Optional.ofNullable(bundle);
        } catch (IOException | RuntimeException ex) {
            log.warn("Cache read failed path={} error={}", imagePath, ex.getMessage());
            return Optional.empty();
        }
    }

    public void store(Path imagePath, AssetBundle bundle) {
        try {
            ContentFingerprint fingerprint = ContentFingerprint.of(imagePath);
            Files.createDirectories(cacheDir);
            Path entry = entryPath(fingerprint);
            Path temp = Files.createTempFile(cacheDir, "pending-", ".tmp");
            try {
                writer.writeValue(temp.toFile(), bundle);
                Files.move(temp, entry, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.info("Cache saved fingerprint={}", fingerprint.shortForm());
        } catch (IOException | RuntimeException ex) {
            log.warn("Cache write failed path={} error={}", imagePath, ex.getMessage());
        }
    }

    /**
     * Deletes every cache entry and returns how many were removed. Other files in the
     * cache directory are left alone.
     */
    public int clear() {
        if (!Files.isDirectory(cacheDir)) {
            return 0;
        }
        int count = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(cacheDir, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path entry : entries) {
                if (Files.isRegularFile(entry) && Files.deleteIfExists(entry)) {
                    count++;
                }
            }
        } catch (IOException ex) {
            log.warn("Cache clear interrupted after {} entries error={}", count, ex.getMessage());
        }
        log.info("Cache cleared entries={}", count);
        return count;
    }

    public Path cacheDir() {
        return cacheDir;
    }

    Path entryPath(ContentFingerprint fingerprint) {
        return cacheDir.resolve(FILE_PREFIX + fingerprint.hex() + FILE_SUFFIX);
    }
}
