package app.listify.assets.support.video;

import app.listify.assets.error.EncodingException;
import app.listify.assets.support.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * H.264 encoding through the ffmpeg binary with a fixed quality preset so identical frames
 * always produce comparable output.
 */
@Component
public class FfmpegVideoEncoder implements VideoEncoder {

    private static final Logger log = LoggerFactory.getLogger(FfmpegVideoEncoder.class);

    private final String ffmpegPath;
    private final Duration timeout;

    public FfmpegVideoEncoder(@Value("${app.assets.turntable.ffmpeg-path:ffmpeg}") String ffmpegPath,
                              @Value("${app.assets.turntable.ffmpeg-timeout-seconds:600}") long timeoutSeconds) {
        this.ffmpegPath = ffmpegPath == null || ffmpegPath.isBlank() ? "ffmpeg" : ffmpegPath.trim();
        this.timeout = Duration.ofSeconds(Math.max(timeoutSeconds, 5));
    }

    @Override
    public void encode(Path frameDirectory, String framePattern, int fps, Path output) {
        List<String> command = List.of(
                ffmpegPath,
                "-hide_banner",
                "-loglevel", "error",
                "-y",
                "-framerate", Integer.toString(fps),
                "-i", frameDirectory.resolve(framePattern).toString(),
                "-c:v", "libx264",
                "-pix_fmt", "yuv420p",
                "-crf", "23",
                "-preset", "medium",
                output.toString()
        );
        ProcessRunner.ProcessResult result;
        try {
            result = ProcessRunner.run(command, timeout);
        } catch (IOException ex) {
            throw new EncodingException("Failed to start ffmpeg: " + ex.getMessage(), ex);
        } catch (IllegalStateException ex) {
            throw new EncodingException("ffmpeg did not finish: " + ex.getMessage(), ex);
        }
        if (!result.succeeded()) {
            log.warn("ffmpeg exited with code={} output={}", result.exitCode(), result.summary());
            throw new EncodingException("FFmpeg encoding failed: " + result.summary());
        }
    }
}
