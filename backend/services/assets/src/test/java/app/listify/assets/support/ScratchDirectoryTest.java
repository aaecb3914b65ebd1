package app.listify.assets.support;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScratchDirectoryTest {

    @Test
    void closeRemovesNestedContent() throws Exception {
        Path root;
        try (ScratchDirectory scratch = ScratchDirectory.create("scratch-test-")) {
            root = scratch.path();
            Files.writeString(scratch.resolve("frame_0000.png"), "x");
            Files.createDirectories(scratch.resolve("nested"));
            Files.writeString(scratch.resolve("nested").resolve("inner.txt"), "y");
            assertTrue(Files.isDirectory(root));
        }

        assertFalse(Files.exists(root));
    }
}
