package app.listify.assets.service;

import app.listify.assets.domain.AssetBundle;
import app.listify.assets.domain.type.AssetFormat;
import app.listify.assets.domain.type.AssetStatus;
import app.listify.assets.support.ContentFingerprint;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class ContentCacheTest {

    @TempDir
    Path tempDir;

    @Test
    void storedBundleIsReturnedForSameBytes() throws Exception {
        ContentCache cache = new ContentCache(new ObjectMapper(), tempDir.resolve("cache").toString());
        Path image = Files.write(tempDir.resolve("shoe.png"), new byte[]{10, 20, 30});
        Path copy = Files.write(tempDir.resolve("shoe-copy.png"), new byte[]{10, 20, 30});
        AssetBundle bundle = completedBundle();

        cache.store(image, bundle);
        Optional<AssetBundle> found = cache.lookup(copy);

        assertThat(found).contains(bundle);
        Path entry = cache.entryPath(ContentFingerprint.of(image));
        assertThat(entry.getFileName().toString()).startsWith("3d_assets_").endsWith(".json");
        assertThat(Files.readString(entry)).contains("\"status\" : \"completed\"");
    }

    @Test
    void lookupOfUnknownImageIsEmpty() throws Exception {
        ContentCache cache = new ContentCache(new ObjectMapper(), tempDir.resolve("cache").toString());
        Path image = Files.write(tempDir.resolve("new.png"), new byte[]{1});

        assertThat(cache.lookup(image)).isEmpty();
    }

    @Test
    void corruptEntryIsTreatedAsMiss() throws Exception {
        ContentCache cache = new ContentCache(new ObjectMapper(), tempDir.resolve("cache").toString());
        Path image = Files.write(tempDir.resolve("broken.png"), new byte[]{7, 7});
        Files.createDirectories(cache.cacheDir());
        Files.writeString(cache.entryPath(ContentFingerprint.of(image)), "{not json");

        assertThat(cache.lookup(image)).isEmpty();
    }

    @Test
    void clearRemovesOnlyCacheEntries() throws Exception {
        ContentCache cache = new ContentCache(new ObjectMapper(), tempDir.resolve("cache").toString());
        for (int i = 0; i < 3; i++) {
            Path image = Files.write(tempDir.resolve("img" + i + ".png"), new byte[]{(byte) i});
            cache.store(image, completedBundle());
        }
        Path unrelated = Files.writeString(cache.cacheDir().resolve("notes.json"), "{}");

        int removed = cache.clear();

        assertThat(removed).isEqualTo(3);
        assertThat(unrelated).exists();
        try (Stream<Path> remaining = Files.list(cache.cacheDir())) {
            assertThat(remaining).containsExactly(unrelated);
        }
    }

    @Test
    void clearOnMissingDirectoryReturnsZero() {
        ContentCache cache = new ContentCache(new ObjectMapper(), tempDir.resolve("absent").toString());

        assertThat(cache.clear()).isZero();
    }

    private static AssetBundle completedBundle() {
        return new AssetBundle(
                "data/models/ab12cd34.glb",
                "data/models/ab12cd34.mp4",
                null,
                List.of("https://cdn.example.com/render_front.png"),
                List.of(),
                "uploads/shoe_processed.png",
                AssetStatus.completed,
                EnumSet.of(AssetFormat.model, AssetFormat.video),
                12.5,
                null,
                null
        );
    }
}
