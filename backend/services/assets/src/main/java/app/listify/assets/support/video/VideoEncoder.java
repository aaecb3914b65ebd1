package app.listify.assets.support.video;

import java.nio.file.Path;

public interface VideoEncoder {

    /**
     * Encodes numbered frames ({@code framePattern} uses printf syntax, e.g. {@code frame_%04d.png})
     * from {@code frameDirectory} into {@code output}.
     */
    void encode(Path frameDirectory, String framePattern, int fps, Path output);
}
