package app.listify.assets.support.video;

import app.listify.assets.error.EncodingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FfmpegVideoEncoderTest {

    @TempDir
    Path tempDir;

    @Test
    void missingBinaryRaisesEncodingException() {
        FfmpegVideoEncoder encoder = new FfmpegVideoEncoder(tempDir.resolve("no-such-ffmpeg").toString(), 10);

        EncodingException ex = assertThrows(EncodingException.class,
                () -> encoder.encode(tempDir, "frame_%04d.png", 10, tempDir.resolve("out.mp4")));

        assertTrue(ex.getMessage().startsWith("Failed to start ffmpeg"));
    }
}
