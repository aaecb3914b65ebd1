package app.listify.assets.error;

/**
 * Raised when too few turntable frames rendered for the video to represent the model.
 */
public class PartialRenderException extends EncodingException {

    private final int renderedFrames;
    private final int requestedFrames;

    public PartialRenderException(int renderedFrames, int requestedFrames) {
        super("Too many frame rendering failures: " + renderedFrames + "/" + requestedFrames + " rendered");
        this.renderedFrames = renderedFrames;
        this.requestedFrames = requestedFrames;
    }

    public int renderedFrames() {
        return renderedFrames;
    }

    public int requestedFrames() {
        return requestedFrames;
    }
}
